package com.codeheadsystems.dynamap.converter;

import com.codeheadsystems.dynamap.api.Cursor;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for handing match cursors to clients as opaque tokens.
 * Tokens are the JSON form of the cursor, URL safe Base64 encoded.
 */
@Singleton
public class CursorCodec {

  private static final Logger log = LoggerFactory.getLogger(CursorCodec.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Cursor codec.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public CursorCodec(final ObjectMapper objectMapper) {
    log.info("CursorCodec({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  /**
   * Encodes a cursor to a token.
   *
   * @param cursor the cursor
   * @return the token
   */
  public String encode(final Cursor cursor) {
    log.trace("encode({})", cursor);
    try {
      final String json = objectMapper.writeValueAsString(cursor);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    } catch (Exception e) {
      log.error("Failed to encode cursor: {}", cursor, e);
      throw new IllegalArgumentException("Failed to encode cursor", e);
    }
  }

  /**
   * Decodes a token to a cursor.
   *
   * @param token the token
   * @return the cursor
   * @throws IllegalArgumentException if the token was not produced by this codec
   */
  public Cursor decode(final String token) {
    log.trace("decode({})", token);
    try {
      final byte[] decoded = Base64.getUrlDecoder().decode(token);
      final Cursor cursor = objectMapper.readValue(new String(decoded, StandardCharsets.UTF_8), Cursor.class);
      if (cursor.hashKey().isEmpty()) {
        throw new IllegalArgumentException("Cursor has no hash key");
      }
      return cursor;
    } catch (Exception e) {
      log.error("Failed to decode cursor: {}", token, e);
      throw new IllegalArgumentException("Invalid cursor", e);
    }
  }
}
