/**
 * Pure Java value types shared across all inventory modules.
 *
 * <p>Inventory report formats and key match modes. Manifest and record types
 * live in {@code modules/core}. This module has no framework dependencies.
 */
package com.libragraph.inventory.types;
