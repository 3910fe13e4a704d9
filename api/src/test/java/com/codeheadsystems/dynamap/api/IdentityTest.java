package com.codeheadsystems.dynamap.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class IdentityTest {

  @Test
  void of_splitsPrefixAndPath() {
    final Identity identity = Identity.of("person:joe/address/home");

    assertThat(identity.prefix()).isEqualTo("person");
    assertThat(identity.path()).isEqualTo("joe/address/home");
    assertThat(identity.segments()).containsExactly("joe", "address", "home");
    assertThat(identity.rank()).isEqualTo(4);
  }

  @Test
  void of_withoutPrefix() {
    final Identity identity = Identity.of("joe/address");

    assertThat(identity.prefix()).isEmpty();
    assertThat(identity.segments()).containsExactly("joe", "address");
    assertThat(identity.rank()).isEqualTo(2);
  }

  @Test
  void of_colonAfterSlashIsPartOfPath() {
    final Identity identity = Identity.of("a/b:c");

    assertThat(identity.prefix()).isEmpty();
    assertThat(identity.path()).isEqualTo("a/b:c");
  }

  @Test
  void of_normalizesSafeFormAndWhitespace() {
    assertThat(Identity.of("[person:joe]")).isEqualTo(Identity.of("person:joe"));
    assertThat(Identity.of(" person:joe ")).isEqualTo(Identity.of("person:joe"));
  }

  @Test
  void of_keepsTrailingSlash() {
    final Identity children = Identity.of("order/");

    assertThat(children).hasToString("order/");
    assertThat(children).isNotEqualTo(Identity.of("order"));
    assertThat(children.segments()).containsExactly("order");
    assertThat(Identity.of("order/1").startsWith(children)).isTrue();
    assertThat(Identity.of("orders/9").startsWith(children)).isFalse();
    assertThat(children.join("1")).hasToString("order/1");
  }

  @Test
  void of_emptyValues() {
    assertThat(Identity.of((String) null)).isSameAs(Identity.EMPTY);
    assertThat(Identity.of("  ")).isSameAs(Identity.EMPTY);
    assertThat(Identity.of("[]")).isSameAs(Identity.EMPTY);
    assertThat(Identity.EMPTY.isEmpty()).isTrue();
    assertThat(Identity.EMPTY.rank()).isZero();
  }

  @Test
  void of_prefixAndSegments() {
    assertThat(Identity.of("person", "joe", "home")).hasToString("person:joe/home");
    assertThat(Identity.of("", "joe", "home")).hasToString("joe/home");
  }

  @Test
  void join_appendsSegments() {
    assertThat(Identity.of("person:joe").join("address", "home")).hasToString("person:joe/address/home");
    assertThat(Identity.of("person:").join("joe")).hasToString("person:joe");
    assertThat(Identity.EMPTY.join("joe")).hasToString("joe");
  }

  @Test
  void parent_dropsLastSegment() {
    final Identity identity = Identity.of("person:joe/address/home");

    assertThat(identity.parent()).hasToString("person:joe/address");
    assertThat(identity.parent().parent().parent()).hasToString("person:");
    assertThat(Identity.of("joe").parent()).isSameAs(Identity.EMPTY);
  }

  @Test
  void startsWith_followsHierarchy() {
    final Identity parent = Identity.of("person:joe");

    assertThat(parent.join("address").startsWith(parent)).isTrue();
    assertThat(Identity.of("person:ann").startsWith(parent)).isFalse();
  }

  @Test
  void safe_wrapsInBrackets() {
    assertThat(Identity.of("person:joe").safe()).isEqualTo("[person:joe]");
  }

  @Test
  void compareTo_isLexicographic() {
    final List<Identity> identities = new ArrayList<>(List.of(
        Identity.of("b:1"), Identity.of("a:2/x"), Identity.of("a:2"), Identity.of("a:10")));

    Collections.sort(identities);

    assertThat(identities).extracting(Identity::toString).containsExactly("a:10", "a:2", "a:2/x", "b:1");
  }

  @Test
  void json_isPlainString() throws Exception {
    final ObjectMapper mapper = new ObjectMapper();

    final String json = mapper.writeValueAsString(Identity.of("person:joe"));

    assertThat(json).isEqualTo("\"person:joe\"");
    assertThat(mapper.readValue(json, Identity.class)).isEqualTo(Identity.of("person:joe"));
  }
}
