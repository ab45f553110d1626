package me.christianrobert.pystyle.transformer.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.christianrobert.pystyle.config.model.ConversionConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * SHA-256 fingerprints for the conversion cache.
 *
 * <p>The environment fingerprint covers everything except the source: the serialized
 * configuration and the ordered {@code id:version} tokens of the active plugins.
 * The entry fingerprint adds the raw source bytes to it.</p>
 */
public final class FingerprintCalculator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final byte SEPARATOR = 0;

    private FingerprintCalculator() {
    }

    public static String environmentFingerprint(ConversionConfig config, List<String> pluginTokens) {
        MessageDigest digest = sha256();
        try {
            digest.update(MAPPER.writeValueAsBytes(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize conversion configuration " + config, e);
        }
        for (String token : pluginTokens) {
            digest.update(SEPARATOR);
            digest.update(token.getBytes(StandardCharsets.UTF_8));
        }
        return toHex(digest.digest());
    }

    public static String fingerprint(String source, String environmentFingerprint) {
        MessageDigest digest = sha256();
        digest.update(source.getBytes(StandardCharsets.UTF_8));
        digest.update(SEPARATOR);
        digest.update(environmentFingerprint.getBytes(StandardCharsets.UTF_8));
        return toHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder out = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            String hex = Integer.toHexString(b & 0xff);
            if (hex.length() == 1) {
                out.append('0');
            }
            out.append(hex);
        }
        return out.toString();
    }
}
