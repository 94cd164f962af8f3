package dev.pekelund.shelfscan.scanner.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class AiResponseParserTest {

    private final AiResponseParser parser = new AiResponseParser(new ObjectMapper());

    @Test
    void parsesBareArrayOfNames() {
        assertThat(parser.parseProductNames("[\"Maggi Noodles\", \" Amul Butter \", \"\"]"))
            .containsExactly("Maggi Noodles", "Amul Butter");
    }

    @Test
    void parsesProductObject() {
        String response = """
            {"imageType": "receipt", "products": [
              {"name": "Parle G", "price": 10, "quantity": 2},
              {"name": "  "},
              {"price": 5}
            ]}
            """;

        assertThat(parser.parseProductNames(response)).containsExactly("Parle G");
    }

    @Test
    void stripsCodeFences() {
        assertThat(parser.parseProductNames("```json\n[\"Dettol Soap\"]\n```")).containsExactly("Dettol Soap");
    }

    @Test
    void findsJsonEmbeddedInProse() {
        assertThat(parser.parseProductNames("Here are the products: [\"Lux Soap\", \"Dove Shampoo\"] Hope this helps"))
            .containsExactly("Lux Soap", "Dove Shampoo");
    }

    @Test
    void rejectsTextWithoutJson() {
        assertThatThrownBy(() -> parser.parseProductNames("I could not read the image"))
            .isInstanceOf(AiResponseParseException.class);
    }

    @Test
    void rejectsObjectWithoutProducts() {
        assertThatThrownBy(() -> parser.parseProductNames("{\"imageType\": \"unknown\"}"))
            .isInstanceOf(AiResponseParseException.class)
            .hasMessageContaining("neither");
    }

    @Test
    void rejectsEmptyResponse() {
        assertThatThrownBy(() -> parser.parseProductNames("  "))
            .isInstanceOf(AiResponseParseException.class);
    }

    @Test
    void sanitiseRemovesInlineBackticks() {
        assertThat(AiResponseParser.sanitiseResponse("`[\"a\"]`")).isEqualTo("[\"a\"]");
    }
}
