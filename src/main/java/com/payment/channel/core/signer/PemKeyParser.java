package com.payment.channel.core.signer;

import com.payment.channel.api.InvalidKeyMaterialException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.CertificateFactory;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads RSA keys in the shapes providers hand out: PKCS#8 and PKCS#1 private keys,
 * X.509 public keys, PKCS#1 public keys, X.509 certificates, and bare Base64 bodies
 * without PEM armour (as pasted from provider consoles).
 */
public final class PemKeyParser {

    private static final Pattern ARMOUR = Pattern.compile("-----BEGIN ([A-Z0-9 ]+)-----(.*?)-----END \\1-----", Pattern.DOTALL);

    /** AlgorithmIdentifier for rsaEncryption with NULL parameters. */
    private static final byte[] RSA_ALGORITHM_ID = {
            0x30, 0x0D, 0x06, 0x09, 0x2A, (byte) 0x86, 0x48, (byte) 0x86,
            (byte) 0xF7, 0x0D, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private PemKeyParser() {}

    public static RSAPrivateCrtKey parsePrivateKey(String pem) {
        Block block = read(pem, "private key");
        try {
            PrivateKey key;
            if ("RSA PRIVATE KEY".equals(block.type)) {
                key = rsaKeyFactory().generatePrivate(new PKCS8EncodedKeySpec(wrapPkcs1PrivateKey(block.der)));
            } else if ("PRIVATE KEY".equals(block.type)) {
                key = rsaKeyFactory().generatePrivate(new PKCS8EncodedKeySpec(block.der));
            } else if (block.type == null) {
                key = generatePrivateEitherForm(block.der);
            } else {
                throw new InvalidKeyMaterialException("Unsupported private key block: " + block.type);
            }
            if (!(key instanceof RSAPrivateCrtKey)) {
                throw new InvalidKeyMaterialException("Private key is not an RSA CRT key");
            }
            return (RSAPrivateCrtKey) key;
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Cannot parse RSA private key: " + e.getMessage(), e);
        }
    }

    public static RSAPublicKey parsePublicKey(String pem) {
        Block block = read(pem, "public key");
        try {
            PublicKey key;
            if ("CERTIFICATE".equals(block.type)) {
                key = CertificateFactory.getInstance("X.509")
                        .generateCertificate(new ByteArrayInputStream(block.der))
                        .getPublicKey();
            } else if ("RSA PUBLIC KEY".equals(block.type)) {
                key = rsaKeyFactory().generatePublic(new X509EncodedKeySpec(wrapPkcs1PublicKey(block.der)));
            } else if ("PUBLIC KEY".equals(block.type)) {
                key = rsaKeyFactory().generatePublic(new X509EncodedKeySpec(block.der));
            } else if (block.type == null) {
                key = generatePublicEitherForm(block.der);
            } else {
                throw new InvalidKeyMaterialException("Unsupported public key block: " + block.type);
            }
            if (!(key instanceof RSAPublicKey)) {
                throw new InvalidKeyMaterialException("Public key is not an RSA key");
            }
            return (RSAPublicKey) key;
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Cannot parse RSA public key: " + e.getMessage(), e);
        }
    }

    /** Public half of a CRT private key; lets a signer verify its own output. */
    public static RSAPublicKey derivePublicKey(RSAPrivateCrtKey privateKey) {
        try {
            return (RSAPublicKey) rsaKeyFactory().generatePublic(
                    new RSAPublicKeySpec(privateKey.getModulus(), privateKey.getPublicExponent()));
        } catch (GeneralSecurityException e) {
            throw new InvalidKeyMaterialException("Cannot derive RSA public key", e);
        }
    }

    /** PEM armour for a DER body, 64 columns per line. */
    public static String toPem(String type, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }

    private static PrivateKey generatePrivateEitherForm(byte[] der) throws GeneralSecurityException {
        try {
            return rsaKeyFactory().generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException e) {
            return rsaKeyFactory().generatePrivate(new PKCS8EncodedKeySpec(wrapPkcs1PrivateKey(der)));
        }
    }

    private static PublicKey generatePublicEitherForm(byte[] der) throws GeneralSecurityException {
        try {
            return rsaKeyFactory().generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException e) {
            return rsaKeyFactory().generatePublic(new X509EncodedKeySpec(wrapPkcs1PublicKey(der)));
        }
    }

    private static Block read(String pem, String what) {
        if (pem == null || pem.isBlank()) {
            throw new InvalidKeyMaterialException("No " + what + " configured");
        }
        Matcher matcher = ARMOUR.matcher(pem);
        String type = null;
        String body = pem;
        if (matcher.find()) {
            type = matcher.group(1);
            body = matcher.group(2);
        } else if (pem.contains("-----BEGIN")) {
            throw new InvalidKeyMaterialException("Unterminated PEM block in " + what);
        }
        try {
            return new Block(type, Base64.getMimeDecoder().decode(body.trim()));
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Invalid Base64 in " + what, e);
        }
    }

    /** PKCS#1 RSAPrivateKey → PKCS#8 PrivateKeyInfo. */
    private static byte[] wrapPkcs1PrivateKey(byte[] pkcs1) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(new byte[]{0x02, 0x01, 0x00});
        body.writeBytes(RSA_ALGORITHM_ID);
        body.writeBytes(tlv(0x04, pkcs1));
        return tlv(0x30, body.toByteArray());
    }

    /** PKCS#1 RSAPublicKey → X.509 SubjectPublicKeyInfo. */
    private static byte[] wrapPkcs1PublicKey(byte[] pkcs1) {
        byte[] bitString = new byte[pkcs1.length + 1];
        System.arraycopy(pkcs1, 0, bitString, 1, pkcs1.length);
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(RSA_ALGORITHM_ID);
        body.writeBytes(tlv(0x03, bitString));
        return tlv(0x30, body.toByteArray());
    }

    private static byte[] tlv(int tag, byte[] value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(tag);
        int length = value.length;
        if (length < 0x80) {
            out.write(length);
        } else {
            int bytes = length > 0xFFFFFF ? 4 : length > 0xFFFF ? 3 : length > 0xFF ? 2 : 1;
            out.write(0x80 | bytes);
            for (int i = bytes - 1; i >= 0; i--) {
                out.write((length >>> (8 * i)) & 0xFF);
            }
        }
        out.writeBytes(value);
        return out.toByteArray();
    }

    private static KeyFactory rsaKeyFactory() throws GeneralSecurityException {
        return KeyFactory.getInstance("RSA");
    }

    private static final class Block {
        final String type;
        final byte[] der;

        Block(String type, byte[] der) {
            this.type = type;
            this.der = der;
        }
    }
}
