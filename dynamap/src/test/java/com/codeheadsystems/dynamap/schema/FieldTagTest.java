package com.codeheadsystems.dynamap.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import org.junit.jupiter.api.Test;

class FieldTagTest {

  @Test
  void parse_nameOnly() {
    final FieldTag tag = FieldTag.parse("anothername");
    assertThat(tag.storageName()).isEqualTo("anothername");
    assertThat(tag.omitEmpty()).isFalse();
    assertThat(tag.setKind()).isEmpty();
  }

  @Test
  void parse_withOptions() {
    final FieldTag tag = FieldTag.parse("tags,omitempty,stringset");
    assertThat(tag.storageName()).isEqualTo("tags");
    assertThat(tag.omitEmpty()).isTrue();
    assertThat(tag.setKind()).contains(SetKind.STRING_SET);
    assertThat(tag).hasToString("tags,omitempty,stringset");
  }

  @Test
  void parse_numberAndBinarySets() {
    assertThat(FieldTag.parse("n,numberset").setKind()).contains(SetKind.NUMBER_SET);
    assertThat(FieldTag.parse("b,binaryset").setKind()).contains(SetKind.BINARY_SET);
  }

  @Test
  void parse_emptyName_fails() {
    assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> FieldTag.parse(""));
    assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> FieldTag.parse(",omitempty"));
  }

  @Test
  void parse_unknownOption_fails() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> FieldTag.parse("name,sometimes"))
        .withMessageContaining("sometimes");
  }

  @Test
  void parse_twoSetKinds_fails() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> FieldTag.parse("name,stringset,numberset"));
  }
}
