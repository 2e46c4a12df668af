package io.github.panghy.pluginproxy.proxy.backend;

import java.util.List;

/**
 * The host's file picker.
 */
public interface FileChooserBackend {

  /**
   * Receives the outcome of a picker session.
   */
  interface ChooseCallback {
    /**
     * @param result OK or an error code
     * @param files  The chosen files, empty when nothing was chosen
     */
    void onChosen(int result, List<ChosenFile> files);
  }

  int create(int instance, FileChooserMode mode, String acceptMimeTypes);

  /**
   * Shows the picker.
   *
   * @param chooser  The chooser
   * @param callback Receives the outcome
   * @return OK_COMPLETIONPENDING, or an error code if the picker could not be shown
   */
  int show(int chooser, ChooseCallback callback);
}
