package hierfed.common.crypto;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.*;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

public final class KeyFiles {
    private KeyFiles() {}

    public static final String PRIVATE_KEY_FILE = "ed25519.key";
    public static final String PUBLIC_KEY_FILE = "ed25519.pub";

    public static KeyPair generateKeyPair() throws GeneralSecurityException {
        return KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    }

    public static void writeKeyPair(Path privatePem, Path publicPem, KeyPair kp) throws IOException {
        writePem(privatePem, "PRIVATE KEY", kp.getPrivate().getEncoded());
        writePem(publicPem, "PUBLIC KEY", kp.getPublic().getEncoded());
    }

    public static PrivateKey loadPrivateKeyPem(Path privatePem) throws GeneralSecurityException, IOException {
        byte[] der = readPem(privatePem, "PRIVATE KEY");
        return KeyFactory.getInstance("Ed25519").generatePrivate(new PKCS8EncodedKeySpec(der));
    }

    public static PublicKey loadPublicKeyPem(Path publicPem) throws GeneralSecurityException, IOException {
        return publicKeyFromDer(readPem(publicPem, "PUBLIC KEY"));
    }

    /** Decodes the X.509 encoding carried in registration requests and identity certificates. */
    public static PublicKey publicKeyFromDer(byte[] der) throws GeneralSecurityException {
        return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(der));
    }

    private static void writePem(Path path, String type, byte[] der) throws IOException {
        String base64 = Base64.getMimeEncoder(64, new byte[]{'\n'}).encodeToString(der);
        String pem = "-----BEGIN " + type + "-----\n" + base64 + "\n-----END " + type + "-----\n";
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        Files.writeString(path, pem, StandardCharsets.US_ASCII, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    private static byte[] readPem(Path path, String type) throws IOException {
        String all = Files.readString(path, StandardCharsets.US_ASCII);
        String begin = "-----BEGIN " + type + "-----";
        String end = "-----END " + type + "-----";
        int i = all.indexOf(begin), j = all.indexOf(end);
        if (i < 0 || j < 0) throw new IOException("Invalid PEM: " + path);
        String b64 = all.substring(i + begin.length(), j).replaceAll("\\s", "");
        return Base64.getDecoder().decode(b64);
    }
}
