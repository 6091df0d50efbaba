package com.newsintel.alcalor.service;

import com.newsintel.alcalor.model.ArticleImage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LightboxGalleryParserTest {

    private final LightboxGalleryParser parser = new LightboxGalleryParser("https://www.alcalorpolitico.com");

    @Test
    void readsEntriesInScriptOrder() {
        String script = """
                $(document).ready(function() {
                  $('#galeria').click(function() {
                    $.iLightBox([
                      { URL: "/fotos/originales/1.jpg", caption: "Primera &amp; segunda" },
                      { URL: "/fotos/originales/2.jpg", caption: "Otra" }
                    ]);
                  });
                });
                """;

        assertThat(parser.parse(script)).containsExactly(
                new ArticleImage("https://www.alcalorpolitico.com/fotos/originales/1.jpg", "Primera & segunda"),
                new ArticleImage("https://www.alcalorpolitico.com/fotos/originales/2.jpg", "Otra"));
    }

    @Test
    void ignoresOtherScripts() {
        assertThat(parser.appliesTo("var x = 1;")).isFalse();
        assertThat(parser.parse("var x = 1;")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void skipsEntriesOfAnotherShape() {
        String script = "$.iLightBox([ { caption: \"sin url\", URL: \"/a.jpg\" }, { URL: \"/b.jpg\", caption: \"ok\" } ]);";

        assertThat(parser.parse(script)).extracting(ArticleImage::url)
                .containsExactly("https://www.alcalorpolitico.com/b.jpg");
    }
}
