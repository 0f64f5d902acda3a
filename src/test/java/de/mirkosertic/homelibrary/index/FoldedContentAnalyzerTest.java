package de.mirkosertic.homelibrary.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Folded content analyzer")
class FoldedContentAnalyzerTest {

    private final Analyzer analyzer = new FoldedContentAnalyzer();

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    @Test
    @DisplayName("Should split words and lowercase them")
    void tokenizesAndLowercases() throws IOException {
        assertThat(tokenize("Stanislaw Lem Solaris")).containsExactly("stanislaw", "lem", "solaris");
    }

    @Test
    @DisplayName("Should drop punctuation between words")
    void dropsPunctuation() throws IOException {
        assertThat(tokenize("Ziemia obiecana (Lodz), tom 1")).containsExactly("ziemia", "obiecana", "lodz", "tom", "1");
    }

    @Test
    @DisplayName("Should not fold accents itself")
    void doesNotFold() throws IOException {
        assertThat(tokenize("Żeromski")).containsExactly("żeromski");
    }

    @Test
    @DisplayName("Should lowercase prefix terms")
    void normalizesPrefixTerms() {
        assertThat(analyzer.normalize(BookDocumentMapper.FIELD_CONTENT, "Jane").utf8ToString()).isEqualTo("jane");
    }

    private List<String> tokenize(final String text) throws IOException {
        final List<String> tokens = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream(BookDocumentMapper.FIELD_CONTENT, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        }
        return tokens;
    }
}
