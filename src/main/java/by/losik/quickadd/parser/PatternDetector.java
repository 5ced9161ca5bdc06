package by.losik.quickadd.parser;

import by.losik.quickadd.parser.extract.DescriptionExtractor;
import by.losik.quickadd.parser.extract.EffortExtractor;
import by.losik.quickadd.parser.extract.FolderExtractor;
import by.losik.quickadd.parser.extract.TagExtractor;
import by.losik.quickadd.parser.table.AdvancedRecurrencePatterns;
import by.losik.quickadd.parser.table.DatePatterns;
import by.losik.quickadd.parser.table.LocationPatterns;
import by.losik.quickadd.parser.table.PatternTable;
import by.losik.quickadd.parser.table.PriorityPatterns;
import by.losik.quickadd.parser.table.RecurrencePatterns;
import by.losik.quickadd.parser.table.RelativeTimePatterns;
import by.losik.quickadd.parser.table.ReminderPatterns;
import by.losik.quickadd.parser.table.TimePatterns;
import com.google.inject.Singleton;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cheap yes/no check for whether a line contains anything the pipeline could extract.
 * Uses the very same trigger patterns as the stages and builds no result.
 */
@Singleton
public class PatternDetector {

    private static final List<Pattern> QUICK_SYNTAX = List.of(
            TagExtractor.QUOTED_TAG,
            TagExtractor.SIMPLE_TAG,
            FolderExtractor.QUOTED_FOLDER,
            FolderExtractor.SIMPLE_FOLDER,
            EffortExtractor.HOURS,
            EffortExtractor.MINUTES,
            DescriptionExtractor.TRAILING_DESCRIPTION
    );

    private static final List<PatternTable<?>> TABLES = List.of(
            ReminderPatterns.TABLE,
            AdvancedRecurrencePatterns.TABLE,
            RecurrencePatterns.TABLE,
            RelativeTimePatterns.TABLE,
            DatePatterns.TABLE,
            TimePatterns.TABLE,
            PriorityPatterns.TABLE,
            LocationPatterns.TABLE
    );

    public boolean looksParseable(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (Pattern pattern : QUICK_SYNTAX) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        for (PatternTable<?> table : TABLES) {
            if (table.matchesAny(text)) {
                return true;
            }
        }
        return false;
    }

    /** Every trigger the detector consults, quick syntax first. */
    List<Pattern> triggers() {
        List<Pattern> all = new ArrayList<>(QUICK_SYNTAX);
        TABLES.forEach(table -> all.addAll(table.triggers()));
        return List.copyOf(all);
    }
}
