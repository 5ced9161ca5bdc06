package by.losik.quickadd.parser.extract;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

class FolderExtractorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 10, 0);

    private FolderExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FolderExtractor();
    }

    @Test
    void extract_WithSimpleFolder_ShouldReturnName() {
        StageMatch<String> match = extractor.extract("Buy milk @Home", NOW).orElseThrow();

        Assertions.assertEquals("Home", match.value());
        Assertions.assertEquals("@Home", match.span());
    }

    @Test
    void extract_WithQuotedFolder_ShouldPreferIt() {
        StageMatch<String> match = extractor.extract("Draft @work @\"Side Projects\"", NOW).orElseThrow();

        Assertions.assertEquals("Side Projects", match.value());
        Assertions.assertEquals("@\"Side Projects\"", match.span());
    }

    @Test
    void extract_WithSeveralFolders_ShouldTakeFirst() {
        Assertions.assertEquals("work", extractor.extract("Draft @work @home", NOW).orElseThrow().value());
    }

    @Test
    void extract_WithoutFolder_ShouldReturnEmpty() {
        Assertions.assertTrue(extractor.extract("Meet @ noon", NOW).isEmpty());
    }
}
