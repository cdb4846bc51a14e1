package com.scholary.mp3.converter.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PersonaCatalogTest {

  @Test
  void ordered_shouldFollowConfiguredOrder() {
    PersonaCatalog catalog =
        new PersonaCatalog(
            ExtractionTestSupport.properties(
                List.of("ios", "web", "geo-bypass"), null, null, List.of(), false));

    assertThat(catalog.ordered())
        .extracting(Persona::name)
        .containsExactly("ios", "web", "geo-bypass");
  }

  @Test
  void ordered_shouldMoveCompactPersonasFirstWhenPreferred() {
    PersonaCatalog catalog = new PersonaCatalog(ExtractionTestSupport.properties());

    assertThat(catalog.ordered(true))
        .extracting(Persona::name)
        .containsExactly("android", "web", "ios", "geo-bypass");
    assertThat(catalog.primary(true).name()).isEqualTo("android");
    assertThat(catalog.primary(false).name()).isEqualTo("web");
  }

  @Test
  void constructor_shouldPinForcedPersona() {
    PersonaCatalog catalog =
        new PersonaCatalog(
            ExtractionTestSupport.properties(
                ExtractionTestSupport.ALL_PERSONAS, "ios", null, List.of(), false));

    assertThat(catalog.ordered()).extracting(Persona::name).containsExactly("ios");
  }

  @Test
  void constructor_shouldRejectUnknownPersona() {
    assertThatThrownBy(
            () ->
                new PersonaCatalog(
                    ExtractionTestSupport.properties(
                        List.of("web", "smart-tv"), null, null, List.of(), false)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("smart-tv");
  }
}
