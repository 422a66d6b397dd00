package cpusched.gui.util;

import javafx.application.Platform;
import javafx.scene.control.TextArea;

import java.io.OutputStream;

/**
 * Routes a PrintStream into a TextArea on the JavaFX thread.
 */
public class GuiOutputStream extends OutputStream {
    private final TextArea outputArea;

    public GuiOutputStream(TextArea outputArea) {
        this.outputArea = outputArea;
    }

    @Override
    public void write(int b) {
        char c = (char) b;
        Platform.runLater(() -> outputArea.appendText(String.valueOf(c)));
    }

    @Override
    public void write(byte[] b, int off, int len) {
        String s = new String(b, off, len);
        Platform.runLater(() -> outputArea.appendText(s));
    }
}
