package com.libragraph.inventory.formats.registry;

import com.libragraph.inventory.formats.api.Codec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Matches data files to codecs. All {@link Codec} beans are discovered via CDI;
 * outside a container, {@link #of(Codec...)} builds a registry from an explicit list.
 */
@ApplicationScoped
public class CodecRegistry {

    /** Header size to read for detection. */
    private static final int HEADER_SIZE = 16;

    @Inject
    Instance<Codec> codecs;

    private List<Codec> fixed;

    public static CodecRegistry of(Codec... codecs) {
        CodecRegistry registry = new CodecRegistry();
        registry.fixed = List.of(codecs);
        return registry;
    }

    private Iterable<Codec> codecs() {
        return fixed != null ? fixed : codecs;
    }

    /**
     * Finds a codec matching the given header or filename.
     * Magic bytes win over filename hints.
     */
    public Optional<Codec> findCodec(byte[] header, String filename) {
        Optional<Codec> byMagic = StreamSupport.stream(codecs().spliterator(), false)
                .filter(c -> c.matches(header, null))
                .findFirst();
        if (byMagic.isPresent() || filename == null) {
            return byMagic;
        }
        return StreamSupport.stream(codecs().spliterator(), false)
                .filter(c -> c.matches(new byte[0], filename))
                .findFirst();
    }

    /**
     * Wraps a raw object stream in the decoder its leading bytes call for.
     * Streams without a recognised magic header are returned undecoded, whatever
     * their key suffix says.
     */
    public InputStream open(InputStream raw, String filename) throws IOException {
        BufferedInputStream in = new BufferedInputStream(raw);
        in.mark(HEADER_SIZE);
        byte[] header = in.readNBytes(HEADER_SIZE);
        in.reset();

        Optional<Codec> codec = findCodec(header, null);
        if (codec.isPresent()) {
            return codec.get().decode(in);
        }
        return in;
    }
}
