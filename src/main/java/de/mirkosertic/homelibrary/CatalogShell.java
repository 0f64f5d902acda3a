package de.mirkosertic.homelibrary;

import de.mirkosertic.homelibrary.catalog.BookRecord;
import de.mirkosertic.homelibrary.catalog.Column;
import de.mirkosertic.homelibrary.catalog.InvalidRecordException;
import de.mirkosertic.homelibrary.catalog.RecordNotFoundException;
import de.mirkosertic.homelibrary.normalize.FoldingCacheStats;
import de.mirkosertic.homelibrary.sort.SortState;
import org.apache.lucene.queryparser.classic.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Line-oriented front end for a {@link CatalogSession}.
 *
 * <p>Record values are given as {@code column=value} pairs separated by {@code |}, e.g.
 * {@code insert shelf=A1 | author=Stanisław Lem | title=Solaris}.</p>
 */
public class CatalogShell {

    private static final Logger logger = LoggerFactory.getLogger(CatalogShell.class);

    private static final String PROMPT = "> ";
    private static final String SEPARATOR = " | ";

    private static final String HELP = String.join(System.lineSeparator(),
            "Commands:",
            "  search [text]                    show books matching every word of text (all books if empty)",
            "  list                             show the current result table again",
            "  sort <column>                    sort by column; repeat to reverse the order",
            "  show <id>                        show every field of a book",
            "  insert [from <id>] col=value|..  add a book (from: copy the values of another book first)",
            "  edit <id> col=value|..           change fields of a book",
            "  delete <id>                      remove a book",
            "  count                            number of books in the catalog",
            "  stats                            folding cache statistics",
            "  help                             this text",
            "  quit                             leave",
            "Columns: shelf, author, title, translator, original_title, borrowed");

    private final CatalogSession session;
    private final FoldingCacheStats foldingStats;
    private final BufferedReader in;
    private final PrintWriter out;

    public CatalogShell(final CatalogSession session, final FoldingCacheStats foldingStats,
                        final Reader in, final Writer out) {
        this.session = session;
        this.foldingStats = foldingStats;
        this.in = new BufferedReader(in);
        this.out = new PrintWriter(out, true);
    }

    /**
     * Shows every book, then reads and executes commands until "quit" or end of input.
     */
    public void run() throws IOException {
        out.println(session.title());
        execute("search");

        while (true) {
            out.print(PROMPT);
            out.flush();
            final String line = in.readLine();
            if (line == null || !execute(line)) {
                break;
            }
        }
        out.flush();
    }

    /**
     * @return false if the command ends the session
     */
    boolean execute(final String line) throws IOException {
        final String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        final int space = trimmed.indexOf(' ');
        final String command = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        final String arguments = space < 0 ? "" : trimmed.substring(space + 1).trim();

        try {
            switch (command) {
                case "search" -> {
                    session.search(arguments);
                    printRows();
                }
                case "list" -> printRows();
                case "sort" -> {
                    session.sortBy(parseColumn(arguments));
                    printRows();
                }
                case "show" -> printRecord(session.find(parseId(arguments))
                        .orElseThrow(() -> new RecordNotFoundException(parseId(arguments))));
                case "insert" -> insert(arguments);
                case "edit" -> edit(arguments);
                case "delete" -> {
                    session.delete(parseId(arguments));
                    out.println(session.title());
                    printRows();
                }
                case "count" -> out.println(session.title());
                case "stats" -> out.println(foldingStats);
                case "help" -> out.println(HELP);
                case "quit", "exit" -> {
                    return false;
                }
                default -> out.println("Unknown command: " + command + " (try 'help')");
            }
        } catch (final ParseException e) {
            logger.info("Search '{}' rejected: {}", session.getSearchText(), e.getMessage());
            out.println("Search failed: " + e.getMessage());
        } catch (final InvalidRecordException | RecordNotFoundException | IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
        }
        return true;
    }

    private void insert(final String arguments) throws IOException {
        BookRecord template = new BookRecord(BookRecord.UNASSIGNED_ID, "", "", "", "", "", "");
        String values = arguments;
        if (arguments.toLowerCase(Locale.ROOT).startsWith("from ")) {
            final String rest = arguments.substring(5).trim();
            final int space = rest.indexOf(' ');
            final long sourceId = parseId(space < 0 ? rest : rest.substring(0, space));
            template = session.templateForInsert(sourceId)
                    .orElseThrow(() -> new RecordNotFoundException(sourceId));
            values = space < 0 ? "" : rest.substring(space + 1);
        }
        final BookRecord stored = session.insert(template.with(parseValues(values)));
        out.println("Inserted book " + stored.id());
        out.println(session.title());
        printRows();
    }

    private void edit(final String arguments) throws IOException {
        final int space = arguments.indexOf(' ');
        final long id = parseId(space < 0 ? arguments : arguments.substring(0, space));
        final BookRecord existing = session.find(id).orElseThrow(() -> new RecordNotFoundException(id));
        final Map<Column, String> changes = parseValues(space < 0 ? "" : arguments.substring(space + 1));
        session.update(existing.with(changes));
        out.println("Updated book " + id);
        printRows();
    }

    private void printRows() {
        final SortState sortState = session.getSortState();
        out.println(Column.DISPLAYED.stream()
                .map(column -> column == sortState.column()
                        ? column.label() + (sortState.descending() ? " v" : " ^")
                        : column.label())
                .collect(Collectors.joining(SEPARATOR)));
        final List<BookRecord> rows = session.getRows();
        for (final BookRecord row : rows) {
            out.println(Column.DISPLAYED.stream()
                    .map(column -> column.extract(row))
                    .collect(Collectors.joining(SEPARATOR)));
        }
        out.println("(" + rows.size() + " shown)");
    }

    private void printRecord(final BookRecord record) {
        for (final Column column : Column.values()) {
            out.println(column.label() + ": " + column.extract(record));
        }
    }

    static Map<Column, String> parseValues(final String text) {
        final Map<Column, String> values = new EnumMap<>(Column.class);
        if (text.isBlank()) {
            return values;
        }
        for (final String pair : text.split("\\|")) {
            final int equals = pair.indexOf('=');
            if (equals < 0) {
                throw new IllegalArgumentException("Expected column=value but got '" + pair.trim() + "'");
            }
            final Column column = parseColumn(pair.substring(0, equals));
            if (column == Column.ID) {
                throw new IllegalArgumentException("The id of a book cannot be changed");
            }
            values.put(column, pair.substring(equals + 1).trim());
        }
        return values;
    }

    private static Column parseColumn(final String name) {
        return Column.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown column: " + name.trim()));
    }

    private static long parseId(final String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Not a book id: '" + text.trim() + "'", e);
        }
    }
}
