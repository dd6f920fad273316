/**
 * Inventory data file decoding: streaming compression codecs, the codec
 * registry, and the CSV row tokenizer.
 */
package com.libragraph.inventory.formats;
