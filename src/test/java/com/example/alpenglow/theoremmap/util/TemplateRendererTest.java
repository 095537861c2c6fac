package com.example.alpenglow.theoremmap.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

  @Test
  void fillsPlaceholdersAndBlanksUnknownOnes() {
    String out = TemplateRenderer.render("{{a}} and {{ b }} but {{missing}}.", Map.of("a", 1, "b", "two"));

    assertThat(out).isEqualTo("1 and two but .");
  }

  @Test
  void rawKeysBypassTheEscaper() {
    String out = TemplateRenderer.render("{{x}}|{{raw:x}}", Map.of("x", "<b>"), s -> s.replace("<", "&lt;"));

    assertThat(out).isEqualTo("&lt;b>|<b>");
  }

  @Test
  void valuesWithDollarSignsAreInsertedLiterally() {
    assertThat(TemplateRenderer.render("{{v}}", Map.of("v", "$1 \\ $2"))).isEqualTo("$1 \\ $2");
  }

  @Test
  void acceptsMixedValueMapsAndBlanksMissingRawKeys() {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("count", 3);
    vars.put("label", "<i>");

    String out = TemplateRenderer.render("{{count}} {{label}} [{{raw:absent}}]", vars, s -> s.replace("<", "&lt;"));

    assertThat(out).isEqualTo("3 &lt;i> []");
  }
}
