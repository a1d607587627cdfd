package com.surrealsimple.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Session fake that keeps a single {@code person} table in memory.
 *
 * Understands just the statements the tests send: person creation with a
 * name, select all, delete all, and transaction markers. Statements against
 * the {@code broken} table fail. A composite script is applied atomically, as
 * the engine does.
 */
public class InMemorySession implements DatabaseSession {

    private static final String BEGIN = "BEGIN TRANSACTION;";
    private static final String COMMIT = "COMMIT TRANSACTION;";
    private static final String CANCEL = "CANCEL TRANSACTION;";
    private static final String NOT_EXECUTED = "The query was not executed due to a failed transaction";

    private static final Pattern CREATE_PERSON =
        Pattern.compile("CREATE person:uuid\\(\\) CONTENT \\{ name: '((?:\\\\.|[^'\\\\])*)' \\}");

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> received = new ArrayList<>();
    private List<ObjectNode> committed = new ArrayList<>();
    private List<ObjectNode> staged;
    private int nextId = 1;
    private boolean open = true;
    private SessionException failNext;

    @Override
    public QueryResponse query(String script, Map<String, Object> variables) throws SessionException {
        received.add(script);
        if (failNext != null) {
            SessionException failure = failNext;
            failNext = null;
            throw failure;
        }

        String text = script.trim();
        switch (text) {
            case BEGIN:
                staged = copy(committed);
                return QueryResponse.empty();
            case COMMIT:
                if (staged == null) {
                    return new QueryResponse(List.of(QueryResult.error("There is no transaction to commit")));
                }
                committed = staged;
                staged = null;
                return QueryResponse.empty();
            case CANCEL:
                staged = null;
                return QueryResponse.empty();
            default:
                break;
        }

        if (text.startsWith(BEGIN + "\n") && text.endsWith(COMMIT)) {
            return runComposite(text);
        }
        List<ObjectNode> table = staged != null ? staged : committed;
        return new QueryResponse(List.of(execute(strip(text), table)));
    }

    private QueryResponse runComposite(String script) {
        String[] lines = script.split("\n");
        List<ObjectNode> work = copy(staged != null ? staged : committed);
        List<QueryResult> slots = new ArrayList<>();
        boolean failed = false;
        for (int i = 1; i < lines.length - 1; i++) {
            QueryResult slot = execute(strip(lines[i]), work);
            failed |= !slot.isOk();
            slots.add(slot);
        }
        if (failed) {
            List<QueryResult> rejected = new ArrayList<>();
            for (QueryResult slot : slots) {
                rejected.add(slot.isOk() ? QueryResult.error(NOT_EXECUTED) : slot);
            }
            return new QueryResponse(rejected);
        }
        if (staged != null) {
            staged = work;
        } else {
            committed = work;
        }
        return new QueryResponse(slots);
    }

    private QueryResult execute(String statement, List<ObjectNode> table) {
        Matcher create = CREATE_PERSON.matcher(statement);
        if (create.matches()) {
            ObjectNode record = mapper.createObjectNode();
            record.put("id", "person:" + nextId++);
            record.put("name", create.group(1).replaceAll("\\\\(.)", "$1"));
            table.add(record);
            return QueryResult.ok(mapper.createArrayNode().add(record.deepCopy()));
        }
        if (statement.equals("SELECT * FROM person")) {
            return QueryResult.ok(toArray(table));
        }
        if (statement.equals("DELETE person RETURN BEFORE")) {
            ArrayNode before = toArray(table);
            table.clear();
            return QueryResult.ok(before);
        }
        if (statement.equals("DELETE person")) {
            table.clear();
            return QueryResult.ok(mapper.createArrayNode());
        }
        if (statement.startsWith("CREATE broken")) {
            return QueryResult.error("Forced failure on table broken");
        }
        return QueryResult.error("Unsupported statement: " + statement);
    }

    private ArrayNode toArray(List<ObjectNode> table) {
        ArrayNode array = mapper.createArrayNode();
        table.forEach(record -> array.add(record.deepCopy()));
        return array;
    }

    private static List<ObjectNode> copy(List<ObjectNode> table) {
        return table.stream().map(ObjectNode::deepCopy).collect(Collectors.toCollection(ArrayList::new));
    }

    private static String strip(String statement) {
        return statement.endsWith(";") ? statement.substring(0, statement.length() - 1) : statement;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void setOpen(boolean open) {
        this.open = open;
    }

    public void failNextWith(SessionException failure) {
        this.failNext = failure;
    }

    public List<String> getReceived() {
        return received;
    }

    public boolean inTransaction() {
        return staged != null;
    }

    public List<String> committedNames() {
        return committed.stream().map(r -> r.get("name").asText()).collect(Collectors.toList());
    }
}
