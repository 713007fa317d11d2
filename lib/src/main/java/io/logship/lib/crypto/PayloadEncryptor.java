/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.logship.lib.crypto;

import com.google.common.base.Preconditions;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.NonNull;

/**
 * AES-256-GCM encryption of individual log entries with a key derived from a shared secret.
 *
 * <p>Output layout, base64 encoded: {@code salt(32) | iv(16) | authTag(16) | ciphertext}. A fresh
 * salt and IV are drawn for every call, so the same plaintext never encrypts to the same value.
 */
public class PayloadEncryptor {
  static final int SALT_LENGTH = 32;
  static final int IV_LENGTH = 16;
  static final int AUTH_TAG_LENGTH = 16;
  static final int PBKDF2_ITERATIONS = 100_000;
  private static final int KEY_LENGTH_BITS = 256;

  private static final String CIPHER = "AES/GCM/NoPadding";
  private static final String KEY_DERIVATION = "PBKDF2WithHmacSHA256";

  private final char[] secret;
  private final SecureRandom random;

  public PayloadEncryptor(@NonNull String secretKey) {
    this(secretKey, new SecureRandom());
  }

  PayloadEncryptor(@NonNull String secretKey, @NonNull SecureRandom random) {
    Preconditions.checkArgument(!secretKey.isEmpty(), "secret key must not be empty");
    this.secret = secretKey.toCharArray();
    this.random = random;
  }

  /**
   * @throws IllegalStateException if the JVM's crypto provider rejects the operation
   */
  public String encrypt(@NonNull String plaintext) {
    byte[] salt = randomBytes(SALT_LENGTH);
    byte[] iv = randomBytes(IV_LENGTH);
    try {
      Cipher cipher = Cipher.getInstance(CIPHER);
      cipher.init(
          Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(AUTH_TAG_LENGTH * 8, iv));
      // JCE appends the tag to the ciphertext; the wire layout puts it in front
      byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      int cipherLength = sealed.length - AUTH_TAG_LENGTH;
      ByteBuffer combined = ByteBuffer.allocate(SALT_LENGTH + IV_LENGTH + sealed.length);
      combined.put(salt).put(iv);
      combined.put(sealed, cipherLength, AUTH_TAG_LENGTH);
      combined.put(sealed, 0, cipherLength);
      return Base64.getEncoder().encodeToString(combined.array());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("failed to encrypt log payload", e);
    }
  }

  /**
   * Reverses {@link #encrypt(String)}.
   *
   * @throws IllegalArgumentException if the input is malformed, was produced with another key or
   *     has been tampered with
   */
  public String decrypt(@NonNull String encoded) {
    byte[] combined;
    try {
      combined = Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("encrypted payload is not valid base64", e);
    }
    int headerLength = SALT_LENGTH + IV_LENGTH + AUTH_TAG_LENGTH;
    Preconditions.checkArgument(combined.length >= headerLength, "encrypted payload is too short");

    byte[] salt = Arrays.copyOfRange(combined, 0, SALT_LENGTH);
    byte[] iv = Arrays.copyOfRange(combined, SALT_LENGTH, SALT_LENGTH + IV_LENGTH);
    byte[] tag = Arrays.copyOfRange(combined, SALT_LENGTH + IV_LENGTH, headerLength);
    byte[] ciphertext = Arrays.copyOfRange(combined, headerLength, combined.length);

    byte[] sealed = new byte[ciphertext.length + tag.length];
    System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
    System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);
    try {
      Cipher cipher = Cipher.getInstance(CIPHER);
      cipher.init(
          Cipher.DECRYPT_MODE, deriveKey(salt), new GCMParameterSpec(AUTH_TAG_LENGTH * 8, iv));
      return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new IllegalArgumentException("failed to decrypt log payload", e);
    }
  }

  private SecretKey deriveKey(byte[] salt) throws GeneralSecurityException {
    PBEKeySpec spec = new PBEKeySpec(secret, salt, PBKDF2_ITERATIONS, KEY_LENGTH_BITS);
    try {
      byte[] key = SecretKeyFactory.getInstance(KEY_DERIVATION).generateSecret(spec).getEncoded();
      return new SecretKeySpec(key, "AES");
    } finally {
      spec.clearPassword();
    }
  }

  private byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    random.nextBytes(bytes);
    return bytes;
  }
}
