package com.codeheadsystems.dynamap.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.dynamap.api.Cursor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CursorCodecTest {

  private CursorCodec codec;

  @BeforeEach
  void setup() {
    codec = new CursorCodec(new ObjectMapper());
  }

  @Test
  void encode_isUrlSafe() {
    final String token = codec.encode(Cursor.of("person:joe", "address:home/??>>"));
    assertThat(token).matches("[A-Za-z0-9_-]+");
    assertThat(codec.decode(token)).isEqualTo(Cursor.of("person:joe", "address:home/??>>"));
  }

  @Test
  void decode_emptySortKey() {
    assertThat(codec.decode(codec.encode(Cursor.of("person:joe", ""))).sortKey()).isEmpty();
  }

  @Test
  void decode_garbage_fails() {
    assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> codec.decode("not a token!"));
  }

  @Test
  void decode_withoutHashKey_fails() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> codec.decode(codec.encode(Cursor.of("", "x"))));
  }
}
