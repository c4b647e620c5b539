package sten.steganography.view;

import java.io.PrintWriter;

public class SteganographyViewImpl implements SteganographyView {

    private final PrintWriter out;
    private final PrintWriter err;

    public SteganographyViewImpl() {
        this(new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    public SteganographyViewImpl(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void showMessage(String message) {
        out.println(message);
    }

    @Override
    public void showWarning(String message) {
        err.println("WARNING: " + message);
    }

    @Override
    public void showError(String message) {
        err.println("ERROR: " + message);
    }

    @Override
    public void showSuccess(String message) {
        out.println("SUCCESS: " + message);
    }
}
