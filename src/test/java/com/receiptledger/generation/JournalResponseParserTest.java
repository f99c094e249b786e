package com.receiptledger.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.receiptledger.journal.EntryType;
import com.receiptledger.journal.JournalEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class JournalResponseParserTest {
  private final JournalResponseParser parser = new JournalResponseParser(new ObjectMapper());

  @Test
  @DisplayName("Parses a bare JSON object")
  void parsesRawJson() {
    JournalEntry entry = parser.parse(ModelResponses.BALANCED);

    assertThat(entry.merchant()).isEqualTo("Cafe Luna");
    assertThat(entry.entries()).hasSize(3);
    assertThat(entry.entries().get(2).type()).isEqualTo(EntryType.CREDIT);
    assertThat(entry.lineItems().get(1).quantity()).isEqualByComparingTo("2");
    assertThat(entry.lineItems().get(1).vatRate()).isEqualByComparingTo("0");
    assertThat(entry.totalDebit()).isEqualByComparingTo("20.00");
  }

  @Test
  @DisplayName("Strips code fences before parsing")
  void parsesFencedJson() {
    String response = "```json\n" + ModelResponses.BALANCED + "\n```";

    assertThat(parser.parse(response).reference()).isEqualTo("R-1");
  }

  @Test
  @DisplayName("Recovers the object from surrounding prose")
  void parsesJsonWrappedInProse() {
    String response = "Here is the journal entry you asked for:\n" + ModelResponses.BALANCED
        + "\nLet me know if anything should change.";

    assertThat(parser.parse(response).totalCredit()).isEqualByComparingTo("20.00");
  }

  @Test
  @DisplayName("Recovers a fenced object with prose around it")
  void parsesProseAroundFencedJson() {
    String response = "Sure.\n```\n" + ModelResponses.BALANCED + "\n```\nDone.";

    assertThat(parser.parse(response).entries()).hasSize(3);
  }

  @Test
  @DisplayName("Ignores properties outside the entry shape")
  void ignoresUnknownProperties() {
    String response = ModelResponses.BALANCED.replace("\"reference\":\"R-1\",", "\"reference\":\"R-1\",\"currency\":\"EUR\",");

    assertThat(parser.parse(response).reference()).isEqualTo("R-1");
  }

  @ParameterizedTest
  @DisplayName("Fails instead of guessing on unusable text")
  @ValueSource(strings = {
      "I could not read this receipt.",
      "{ this is not json }",
      "[1, 2, 3]",
      "{\"entries\": \"nope\"}",
      "   "
  })
  void failsClosedOnGarbage(String response) {
    assertThatThrownBy(() -> parser.parse(response)).isInstanceOf(GenerationException.class);
  }

  @Test
  @DisplayName("Rejects an unknown ledger line type")
  void failsOnUnknownEntryType() {
    String response = ModelResponses.BALANCED.replace("\"type\":\"credit\"", "\"type\":\"transfer\"");

    assertThatThrownBy(() -> parser.parse(response)).isInstanceOf(GenerationException.class);
  }
}
