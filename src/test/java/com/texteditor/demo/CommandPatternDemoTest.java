package com.texteditor.demo;

import com.texteditor.model.CommandHistory;
import com.texteditor.model.command.InsertCommand;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class CommandPatternDemoTest {

    @Test
    public void testScenariosEndWithGreetingsTo() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        CommandPatternDemo demo = new CommandPatternDemo(new PrintStream(output, true, StandardCharsets.UTF_8));

        CommandHistory history = demo.runScenarios();

        // Three inserts, one replace, a batch of three
        assertEquals(7, history.getLogSize());
        assertEquals(Arrays.asList(
                "1. Insert", "2. Insert", "3. Insert", "4. Replace",
                "5. Insert", "6. Insert", "7. Insert"), history.getHistoryListing());

        // Replace and the first batch insert are still undoable
        assertEquals(3, history.getUndoDepth());

        InsertCommand first = (InsertCommand) history.getLog().get(0);
        assertEquals("Greetings to", first.getBuffer().getText());

        String console = output.toString(StandardCharsets.UTF_8);
        assertTrue(console.contains("### SCENARIO 4: Batch Execution (Queue) ###"));
        assertTrue(console.contains("Text: 'Greetings! all to'"));
        assertTrue(console.contains("Text: 'Greetings to'"));
        assertTrue(console.contains("6. Macro commands (composite)"));
    }
}
