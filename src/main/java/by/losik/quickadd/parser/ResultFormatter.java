package by.losik.quickadd.parser;

import by.losik.quickadd.dto.AdvancedRepeat;
import by.losik.quickadd.dto.MonthlyType;
import by.losik.quickadd.dto.ParsedTask;
import by.losik.quickadd.dto.RepeatType;
import com.google.inject.Singleton;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a parsed task into short preview badges. Presentation only.
 */
@Singleton
public class ResultFormatter {

    private static final String[] DAY_NAMES = {"Sun", "Mon", "Tue", "Wed", "Thu", "Fri", "Sat"};

    public List<String> format(ParsedTask parsed, LocalDateTime now) {
        List<String> badges = new ArrayList<>();

        if (parsed.dueDate() != null) {
            relativeDue(parsed.dueDate(), now, badges);
        }

        if (parsed.reminderOffset() != null) {
            badges.add(switch (parsed.reminderOffset()) {
                case EXACT -> "🔔 At exact time";
                case FIVE_MINUTES -> "🔔 5 min before";
                case TEN_MINUTES -> "🔔 10 min before";
                case FIFTEEN_MINUTES -> "🔔 15 min before";
                case THIRTY_MINUTES -> "🔔 30 min before";
                case ONE_HOUR -> "🔔 1 hour before";
                case ONE_DAY -> "🔔 1 day before";
            });
        }

        if (parsed.advancedRepeat() != null) {
            badges.add("🔄 " + describe(parsed.advancedRepeat()));
        } else if (parsed.repeatType() == RepeatType.CUSTOM && parsed.repeatDays() != null) {
            badges.add("🔄 Every " + parsed.repeatDays().stream()
                    .map(day -> DAY_NAMES[day])
                    .collect(Collectors.joining(", ")));
        } else if (parsed.repeatType() != null) {
            badges.add("🔄 " + parsed.repeatType().label());
        }

        if (parsed.location() != null) {
            badges.add("📍 " + parsed.location());
        }
        if (parsed.priority() != null) {
            badges.add("⚡ " + parsed.priority().wireName() + " priority");
        }
        if (parsed.estimatedHours() != null && parsed.estimatedHours() > 0) {
            badges.add("⏱ " + effort(parsed.estimatedHours()));
        }
        if (parsed.description() != null) {
            badges.add("📝 " + parsed.description());
        }

        return badges;
    }

    private void relativeDue(LocalDateTime due, LocalDateTime now, List<String> badges) {
        long diffMs = Duration.between(now, due).toMillis();
        long diffMins = Math.round(diffMs / 60_000.0);
        long diffHours = Math.round(diffMs / 3_600_000.0);

        if (diffMins < 0) {
            return;
        }
        if (diffMins < 60) {
            badges.add("in " + diffMins + " min");
        } else if (diffHours < 24) {
            badges.add("in " + diffHours + " hour" + (diffHours > 1 ? "s" : ""));
        }
    }

    static String describe(AdvancedRepeat repeat) {
        if (repeat.monthlyType() == MonthlyType.WEEKDAY && repeat.monthlyWeek() != null && repeat.monthlyDay() != null) {
            return "Every " + ordinal(repeat.monthlyWeek()) + " " + DAY_NAMES[repeat.monthlyDay()];
        }
        if (repeat.monthlyType() == MonthlyType.DATE && repeat.monthlyDay() != null) {
            return "Monthly on day " + repeat.monthlyDay();
        }
        if (repeat.interval() != null) {
            String unit = switch (repeat.frequency()) {
                case HOURLY -> "hour";
                case DAILY -> "day";
                case WEEKLY -> "week";
                case MONTHLY -> "month";
                case YEARLY -> "year";
                default -> repeat.frequency().wireName();
            };
            return "Every " + repeat.interval() + " " + unit + (repeat.interval() == 1 ? "" : "s");
        }
        return repeat.frequency().label();
    }

    private static String ordinal(int week) {
        return switch (week) {
            case 1 -> "1st";
            case 2 -> "2nd";
            case 3 -> "3rd";
            case AdvancedRepeat.LAST_WEEK -> "last";
            default -> week + "th";
        };
    }

    private static String effort(double estimatedHours) {
        long hours = (long) Math.floor(estimatedHours);
        long minutes = Math.round((estimatedHours - hours) * 60);
        if (minutes == 60) {
            hours++;
            minutes = 0;
        }
        return (hours > 0 ? hours + "h" : "") + (minutes > 0 ? minutes + "m" : "");
    }
}
