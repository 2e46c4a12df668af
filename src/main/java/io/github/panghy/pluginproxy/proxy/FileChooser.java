package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.proxy.backend.FileChooserMode;
import io.github.panghy.pluginproxy.resource.PluginResource;
import io.github.panghy.pluginproxy.resource.ResourceTracker;
import io.github.panghy.pluginproxy.resource.WireResourceId;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Plugin-side state of a file chooser: the files picked in the last session that the
 * plugin has not collected yet. The chooser holds one reference to each of them.
 */
public final class FileChooser extends PluginResource {

  private final FileChooserMode mode;
  private final Deque<Integer> chosenFiles = new ArrayDeque<>();

  FileChooser(WireResourceId wireId, FileChooserMode mode) {
    super(wireId);
    this.mode = mode;
  }

  public FileChooserMode getMode() {
    return mode;
  }

  public int pendingChosenFiles() {
    return chosenFiles.size();
  }

  void addChosenFile(int handle) {
    chosenFiles.addLast(handle);
  }

  /**
   * Hands the next chosen file, and the chooser's reference to it, to the caller.
   *
   * @return The file ref handle, 0 if none is left
   */
  int takeNextChosenFile() {
    Integer handle = chosenFiles.pollFirst();
    return handle == null ? 0 : handle;
  }

  void releaseChosenFiles(ResourceTracker tracker) {
    while (!chosenFiles.isEmpty()) {
      tracker.releaseResource(chosenFiles.pollFirst());
    }
  }

  @Override
  protected void lastReferenceReleased(ResourceTracker tracker) {
    releaseChosenFiles(tracker);
  }
}
