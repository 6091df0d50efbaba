package com.newsintel.alcalor.cli;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Parsed command line. Options take {@code --name value} or {@code --name=value};
 * Spring property overrides ({@code --spring.*}, {@code --scraper.*}, {@code --logging.*})
 * are left to Spring and skipped here.
 */
@Value
@Builder
public class ScrapeOptions {

    public static final String USAGE = """
            Usage: alcalor-scraper [options]
              --date YYYY-MM-DD          scrape a single date
              --start-date YYYY-MM-DD    range start (also bounds --backfill)
              --end-date YYYY-MM-DD      range end (also bounds --backfill)
              --today                    scrape today plus the re-scrape window
              --backfill                 walk history backwards from yesterday
              --resume                   with --backfill, continue from the checkpoint
              --concurrent N             concurrent article requests (1-20)
              --db-only                  do not write JSON files
              --no-db                    do not write to the database
              --health-check             check database connectivity and exit
              --help                     show this message
            """;

    private static final Set<String> PASS_THROUGH_PREFIXES = Set.of("--spring.", "--scraper.", "--logging.");

    LocalDate date;
    LocalDate startDate;
    LocalDate endDate;
    boolean today;
    boolean backfill;
    boolean resume;
    Integer concurrent;
    boolean dbOnly;
    boolean noDb;
    boolean healthCheck;
    boolean help;

    public boolean isRange() {
        return startDate != null && endDate != null && !backfill;
    }

    public static ScrapeOptions parse(String... args) throws CliUsageException {
        ScrapeOptionsBuilder b = ScrapeOptions.builder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (PASS_THROUGH_PREFIXES.stream().anyMatch(arg::startsWith)) continue;

            String name = arg;
            String inlineValue = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                inlineValue = arg.substring(eq + 1);
            }

            switch (name) {
                case "--today" -> b.today(true);
                case "--backfill" -> b.backfill(true);
                case "--resume" -> b.resume(true);
                case "--db-only" -> b.dbOnly(true);
                case "--no-db" -> b.noDb(true);
                case "--health-check" -> b.healthCheck(true);
                case "--help", "-h" -> b.help(true);
                case "--date", "--start-date", "--end-date", "--concurrent" -> {
                    String value = inlineValue;
                    if (value == null) {
                        if (i + 1 >= args.length) throw new CliUsageException(name + " requires a value");
                        value = args[++i];
                    }
                    switch (name) {
                        case "--date" -> b.date(parseDate(name, value));
                        case "--start-date" -> b.startDate(parseDate(name, value));
                        case "--end-date" -> b.endDate(parseDate(name, value));
                        default -> b.concurrent(parseInt(name, value));
                    }
                }
                default -> throw new CliUsageException("Unrecognized argument: " + arg);
            }
        }

        ScrapeOptions options = b.build();
        options.validate();
        return options;
    }

    private void validate() throws CliUsageException {
        if (help || healthCheck) return;

        if (dbOnly && noDb) {
            throw new CliUsageException("--db-only and --no-db cannot be combined");
        }
        if (resume && !backfill) {
            throw new CliUsageException("--resume requires --backfill");
        }
        if ((startDate == null) != (endDate == null) && !backfill) {
            throw new CliUsageException("--start-date and --end-date must be given together");
        }
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new CliUsageException("--start-date must not be after --end-date");
        }

        int modes = (date != null ? 1 : 0) + (today ? 1 : 0) + (backfill ? 1 : 0) + (isRange() ? 1 : 0);
        if (modes == 0) {
            throw new CliUsageException("Specify --date, --start-date/--end-date, --today, or --backfill");
        }
        if (modes > 1) {
            throw new CliUsageException("Only one of --date, --start-date/--end-date, --today, --backfill may be used");
        }
    }

    private static LocalDate parseDate(String option, String value) throws CliUsageException {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new CliUsageException("Invalid date for " + option + ": " + value + " (expected YYYY-MM-DD)");
        }
    }

    private static Integer parseInt(String option, String value) throws CliUsageException {
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new CliUsageException("Invalid number for " + option + ": " + value);
        }
    }
}
