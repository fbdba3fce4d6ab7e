package br.edu.ifba.federated.shared;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

public final class UuidUtils {

    /** RFC 4122 namespace for fully-qualified domain names. */
    public static final UUID NAMESPACE_DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    private UuidUtils() {
    }

    /**
     * Generates a name-based UUID v5 (SHA-1) in the given namespace.
     * Same namespace and name always produce the same UUID.
     *
     * @param namespace namespace UUID
     * @param name      the name to hash
     * @return deterministic UUID
     */
    public static UUID nameBasedV5(final UUID namespace, final String name) {
        try {
            final MessageDigest md = MessageDigest.getInstance("SHA-1");
            md.update(asBytes(namespace));
            md.update(name.getBytes(StandardCharsets.UTF_8));
            final byte[] hash = md.digest();

            final ByteBuffer buf = ByteBuffer.wrap(hash);
            long msb = buf.getLong();
            long lsb = buf.getLong();

            msb = (msb & 0xFFFFFFFFFFFF0FFFL) | 0x0000000000005000L;
            lsb = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;

            return new UUID(msb, lsb);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
    }

    /**
     * Chunk identifier shared by the vector point and the graph Chunk node.
     */
    public static String chunkId(final String batchId, final String sourcePath, final int index) {
        return nameBasedV5(NAMESPACE_DNS, batchId + "_" + sourcePath + "_" + index).toString();
    }

    private static byte[] asBytes(final UUID uuid) {
        final ByteBuffer bb = ByteBuffer.allocate(16);
        bb.putLong(uuid.getMostSignificantBits());
        bb.putLong(uuid.getLeastSignificantBits());
        return bb.array();
    }
}
