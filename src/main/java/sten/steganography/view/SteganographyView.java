package sten.steganography.view;

public interface SteganographyView {

    void showMessage(String message);

    void showWarning(String message);

    void showError(String message);

    void showSuccess(String message);
}
