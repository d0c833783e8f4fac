package com.texteditor.demo;

import com.texteditor.model.CommandHistory;
import com.texteditor.model.TextBuffer;
import com.texteditor.model.command.EditCommand;
import com.texteditor.model.command.InsertCommand;
import com.texteditor.model.command.ReplaceCommand;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Walks through the editor commands on a fresh buffer and narrates each step on the console.
 * Enabled with {@code editor.demo.enabled=true} (the {@code demo} profile).
 */
@Component
@ConditionalOnProperty(prefix = "editor.demo", name = "enabled", havingValue = "true")
public class CommandPatternDemo implements CommandLineRunner {
    private static final String RULE = "=".repeat(70);

    private final PrintStream out;

    public CommandPatternDemo() {
        this(System.out);
    }

    CommandPatternDemo(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(String... args) {
        runScenarios();
    }

    /**
     * @return the history after all scenarios, for callers that want to inspect it
     */
    public CommandHistory runScenarios() {
        banner("COMMAND PATTERN DEMONSTRATION - Text Editor");

        TextBuffer editor = new TextBuffer();
        CommandHistory history = new CommandHistory();

        scenario("SCENARIO 1: Basic Commands");
        history.executeCommand(new InsertCommand(editor, "Hello"));
        history.executeCommand(new InsertCommand(editor, " World"));
        history.executeCommand(new InsertCommand(editor, "!"));
        out.println("Text: '" + editor.getText() + "'");

        scenario("SCENARIO 2: Undo Operations");
        history.undo();
        history.undo();
        out.println("Text: '" + editor.getText() + "'");

        scenario("SCENARIO 3: Macro Command (Replace)");
        history.executeCommand(new ReplaceCommand(editor, 0, 5, "Greetings"));
        out.println("Text: '" + editor.getText() + "'");

        // All three take their default position now, before any of them runs
        scenario("SCENARIO 4: Batch Execution (Queue)");
        List<EditCommand> batch = Arrays.asList(
                new InsertCommand(editor, " to"),
                new InsertCommand(editor, " all"),
                new InsertCommand(editor, "!"));
        history.executeBatch(batch);
        out.println("Text: '" + editor.getText() + "'");

        scenario("SCENARIO 5: Multiple Undos");
        history.undo();
        history.undo();
        out.println("Text: '" + editor.getText() + "'");

        scenario("SCENARIO 6: Command History");
        for (String line : history.showHistory()) {
            out.println("  " + line);
        }

        scenario("Final State");
        editor.show();
        out.println("Text: '" + editor.getText() + "'");

        out.println();
        banner("KEY CONCEPTS DEMONSTRATED:");
        out.println("1. Commands as objects (encapsulation)");
        out.println("2. Separation of invoker and receiver");
        out.println("3. Undo capability");
        out.println("4. Command history/logging");
        out.println("5. Command queuing (batch execution)");
        out.println("6. Macro commands (composite)");
        out.println(RULE);

        return history;
    }

    private void banner(String title) {
        out.println(RULE);
        out.println(title);
        out.println(RULE);
    }

    private void scenario(String title) {
        out.println();
        out.println("### " + title + " ###");
    }
}
