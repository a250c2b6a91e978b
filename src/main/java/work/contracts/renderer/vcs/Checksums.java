package work.contracts.renderer.vcs;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Hex digests of module sources, using the hashlib-style algorithm names found in headers.
 */
public final class Checksums {
    private static final Map<String, String> JCA_NAMES = Map.of(
        "md5", "MD5",
        "sha1", "SHA-1",
        "sha224", "SHA-224",
        "sha256", "SHA-256",
        "sha384", "SHA-384",
        "sha512", "SHA-512"
    );

    private Checksums() {
    }

    public static String hexDigest(String algorithm, String text) {
        var name = JCA_NAMES.getOrDefault(algorithm.toLowerCase(Locale.ROOT), algorithm);
        try {
            var digest = MessageDigest.getInstance(name);
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalArgumentException("Unsupported hashing algorithm: " + algorithm, ex);
        }
    }
}
