package io.dana.cert.operator.tls;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.util.io.pem.PemObject;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyStore;
import java.security.Provider;
import java.security.cert.Certificate;
import java.security.interfaces.RSAPrivateKey;
import java.util.Collections;

import io.dana.cert.operator.model.TlsMaterial;
import lombok.val;

/**
 * Decodes the base64 encoded, password protected PKCS#12 archives returned by the certificate
 * API into a PEM certificate and PEM RSA private key.
 */
public class ArchiveDecoder {
  final static private BaseEncoding base64 = BaseEncoding.base64();
  final static private Provider provider = new BouncyCastleProvider();

  final static String ERR_CANNOT_DECODE_B64_DATA = "cannot decode base64-encoded PKCS#12 data: ";
  final static String ERR_CANNOT_DECODE_DATA = "cannot decode PKCS#12 data: ";
  final static String ERR_CANNOT_CAST_TO_RSA_PRIVATE_KEY = "cannot cast to RSA Private Key";

  final static String CERTIFICATE_BLOCK_TYPE = "CERTIFICATE";
  final static String RSA_BLOCK_TYPE = "RSA PRIVATE KEY";

  public TlsMaterial decode(String data, String password) {
    final byte[] archive;
    try {
      archive = base64.decode(CharMatcher.whitespace().removeFrom(Strings.nullToEmpty(data)));
    } catch (IllegalArgumentException e) {
      throw new DecodeException(ERR_CANNOT_DECODE_B64_DATA + e.getMessage(), e);
    }

    val keyStore = load(archive, password);
    val entry = findKeyEntry(keyStore, password);

    if (!(entry.key instanceof RSAPrivateKey)) {
      throw new CastException(ERR_CANNOT_CAST_TO_RSA_PRIVATE_KEY);
    }

    try {
      val certificatePem = encodeCertificate(entry.certificate);
      val privateKeyPem = encodeRsaPrivateKey(entry.key);
      return new TlsMaterial(certificatePem, privateKeyPem);
    } catch (IOException | GeneralSecurityException e) {
      throw new DecodeException(ERR_CANNOT_DECODE_DATA + e.getMessage(), e);
    }
  }

  private static KeyStore load(byte[] archive, String password) {
    try {
      val keyStore = KeyStore.getInstance("PKCS12", provider);
      keyStore.load(new ByteArrayInputStream(archive), chars(password));
      return keyStore;
    } catch (IOException | GeneralSecurityException e) {
      throw new DecodeException(ERR_CANNOT_DECODE_DATA + e.getMessage(), e);
    } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
      // malformed ASN.1 surfaces as unchecked exceptions from the parser
      throw new DecodeException(ERR_CANNOT_DECODE_DATA + e.getMessage(), e);
    }
  }

  private static KeyEntry findKeyEntry(KeyStore keyStore, String password) {
    try {
      for (String alias : Collections.list(keyStore.aliases())) {
        if (keyStore.isKeyEntry(alias)) {
          val key = keyStore.getKey(alias, chars(password));
          val certificate = keyStore.getCertificate(alias);
          if (key != null && certificate != null) {
            return new KeyEntry(key, certificate);
          }
        }
      }
    } catch (GeneralSecurityException e) {
      throw new DecodeException(ERR_CANNOT_DECODE_DATA + e.getMessage(), e);
    }

    throw new DecodeException(ERR_CANNOT_DECODE_DATA + "no private key and certificate found", null);
  }

  private static byte[] encodeCertificate(Certificate certificate)
      throws IOException, GeneralSecurityException {
    return toPem(new PemObject(CERTIFICATE_BLOCK_TYPE, certificate.getEncoded()));
  }

  /* Writes the key in its PKCS#1 form, as expected under an "RSA PRIVATE KEY" block. */
  private static byte[] encodeRsaPrivateKey(Key key) throws IOException {
    val pkcs1 = PrivateKeyInfo.getInstance(key.getEncoded()).parsePrivateKey();
    return toPem(new PemObject(RSA_BLOCK_TYPE, pkcs1.toASN1Primitive().getEncoded()));
  }

  private static byte[] toPem(PemObject pemObject) throws IOException {
    val out = new StringWriter();
    try (JcaPEMWriter pemWriter = new JcaPEMWriter(out)) {
      pemWriter.writeObject(pemObject);
    }
    return out.toString().getBytes(StandardCharsets.US_ASCII);
  }

  private static char[] chars(String password) {
    return password == null ? new char[0] : password.toCharArray();
  }

  private static class KeyEntry {
    final private Key key;
    final private Certificate certificate;

    private KeyEntry(Key key, Certificate certificate) {
      this.key = key;
      this.certificate = certificate;
    }
  }
}
