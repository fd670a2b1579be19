package dev.bookshelf.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.bookshelf.fixture.BookmarkBuilder;
import dev.bookshelf.record.Bookmark;
import org.junit.jupiter.api.Test;

class LexicalScorerTest {

  @Test
  void title_match_scores_title_weight() {
    Bookmark bookmark = new BookmarkBuilder().title("Effective Java").build();

    LexicalScore score = LexicalScorer.score("java", bookmark);

    assertThat(score.score()).isEqualTo(1.0);
    assertThat(score.matchedFields()).containsExactly(MatchedField.TITLE);
  }

  @Test
  void every_field_matching_reaches_the_maximum() {
    Bookmark bookmark =
        new BookmarkBuilder()
            .title("Java tips")
            .keywords("java")
            .tags("java")
            .description("All about Java")
            .url("https://java.example.com")
            .build();

    LexicalScore score = LexicalScorer.score("JAVA", bookmark);

    assertThat(score.score()).isCloseTo(MatchedField.MAX_SCORE, within(1e-9));
    assertThat(score.normalized()).isCloseTo(1.0, within(1e-9));
    assertThat(score.matchedFields()).containsExactlyInAnyOrder(MatchedField.values());
  }

  @Test
  void each_field_contributes_at_most_once() {
    Bookmark bookmark =
        new BookmarkBuilder().title("Other").keywords("java", "javadoc", "java streams").build();

    assertThat(LexicalScorer.score("java", bookmark).score()).isEqualTo(0.8);
  }

  @Test
  void whole_query_must_appear_as_one_substring() {
    Bookmark bookmark =
        new BookmarkBuilder().title("Python tricks").description("Write less code").build();

    assertThat(LexicalScorer.score("python code", bookmark).matched()).isFalse();
    assertThat(LexicalScorer.score("python", bookmark).score()).isEqualTo(1.0);
  }

  @Test
  void query_is_trimmed_before_matching() {
    Bookmark bookmark = new BookmarkBuilder().title("Kotlin coroutines").build();

    assertThat(LexicalScorer.score("  coroutines  ", bookmark).score()).isEqualTo(1.0);
  }

  @Test
  void blank_query_and_no_match_score_zero() {
    Bookmark bookmark = new BookmarkBuilder().title("Anything").build();

    assertThat(LexicalScorer.score("   ", bookmark)).isEqualTo(LexicalScore.NONE);
    assertThat(LexicalScorer.score("rust", bookmark).score()).isZero();
    assertThat(LexicalScorer.score("rust", bookmark).matchedFields()).isEmpty();
  }

  @Test
  void url_and_tag_weights_add_up() {
    Bookmark bookmark =
        new BookmarkBuilder().title("Docs").url("https://gradle.org").tags("gradle").build();

    assertThat(LexicalScorer.score("gradle", bookmark).score()).isCloseTo(0.9, within(1e-9));
  }
}
