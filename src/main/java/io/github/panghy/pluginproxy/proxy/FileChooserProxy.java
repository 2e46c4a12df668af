package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.CallbackKey;
import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.backend.ChosenFile;
import io.github.panghy.pluginproxy.proxy.backend.FileChooserBackend;
import io.github.panghy.pluginproxy.proxy.backend.FileChooserMode;
import io.github.panghy.pluginproxy.resource.WireResourceId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;

/**
 * The host's file picker, shown on behalf of the plugin.
 *
 * <p>When the user is done the host sends the chosen files along with one reference to
 * each. The plugin turns them into {@link FileRef} resources queued on the chooser,
 * from which {@link #getNextChosenFile(int)} hands them out one at a time.</p>
 */
public class FileChooserProxy extends InterfaceProxy {

  private static final Logger LOGGER = Logger.getLogger(FileChooserProxy.class.getName());

  static final int CREATE = 1;
  static final int SHOW = 2;
  static final int CHOOSE_COMPLETE = 3;

  /**
   * A chosen file as it travels on the wire.
   */
  private record WireFile(WireResourceId id, String path, String name) {
  }

  public FileChooserProxy(Dispatcher dispatcher) {
    super(dispatcher);
  }

  @Override
  public ApiGroup getApiGroup() {
    return ApiGroup.FILE_CHOOSER;
  }

  /**
   * Creates a chooser.
   *
   * @param instance        The instance
   * @param mode            Single or multiple selection
   * @param acceptMimeTypes Comma separated MIME types to offer, null for all
   * @return The chooser handle, 0 on failure
   */
  public int create(int instance, FileChooserMode mode, String acceptMimeTypes) {
    if (!servesInstance(instance) || mode == null) {
      return 0;
    }
    WireResourceId id = callSync(CREATE, new ParamWriter()
        .writeInt(instance)
        .writeInt(mode.ordinal())
        .writeString(acceptMimeTypes),
        ParamReader::readResource, WireResourceId.NULL);
    return adoptResource(id, wireId -> new FileChooser(wireId, mode));
  }

  /**
   * Shows the picker.
   *
   * @param chooser The chooser handle
   * @return Completes when the user is done; INPROGRESS at once if the picker is showing
   */
  public ResultFuture<Integer> show(int chooser) {
    FileChooser object = tracker().getAs(chooser, FileChooser.class);
    if (object == null) {
      return ResultFuture.completed(ResultCode.BADRESOURCE.getCode());
    }
    CallbackKey key = CallbackKey.single(object.getWireId(), SHOW);
    if (dispatcher.getCallbackTracker().isPending(key)) {
      return ResultFuture.completed(ResultCode.INPROGRESS.getCode());
    }
    return sendAsync(key, SHOW, new ParamWriter().writeResource(object.getWireId()), null);
  }

  /**
   * Takes the next file chosen in the last session. The caller owns a reference to it.
   *
   * @param chooser The chooser handle
   * @return The file ref handle, 0 if there are no more
   */
  public int getNextChosenFile(int chooser) {
    FileChooser object = tracker().getAs(chooser, FileChooser.class);
    return object == null ? 0 : object.takeNextChosenFile();
  }

  @Override
  public boolean onMessageReceived(WireMessage message, ParamWriter reply) {
    ParamReader params = message.reader();
    if (!dispatcher.isHost()) {
      if (message.getKind() != CHOOSE_COMPLETE) {
        return false;
      }
      onChooseComplete(params);
      return true;
    }
    FileChooserBackend backend = backend(FileChooserBackend.class);
    switch (message.getKind()) {
      case CREATE:
        int instance = params.readInt();
        int modeOrdinal = params.readInt();
        String accept = params.readString();
        FileChooserMode[] modes = FileChooserMode.values();
        int chooser = 0;
        if (backend != null && modeOrdinal >= 0 && modeOrdinal < modes.length) {
          chooser = backend.create(instance, modes[modeOrdinal], accept);
        }
        if (reply != null) {
          reply.writeResource(new WireResourceId(instance, chooser));
        }
        return true;
      case SHOW:
        WireResourceId id = params.readResource();
        if (backend == null) {
          sendChooseComplete(id, ResultCode.NOINTERFACE.getCode(), Collections.emptyList());
          return true;
        }
        int result = backend.show(id.hostResource(), (chosenResult, files) -> sendChooseComplete(id, chosenResult, files));
        if (result != ResultCode.OK_COMPLETIONPENDING.getCode()) {
          sendChooseComplete(id, result, Collections.emptyList());
        }
        return true;
      default:
        return false;
    }
  }

  private void sendChooseComplete(WireResourceId chooser, int result, List<ChosenFile> files) {
    ParamWriter params = new ParamWriter()
        .writeResource(chooser)
        .writeInt(result)
        .writeInt(files.size());
    for (ChosenFile file : files) {
      params.writeResource(new WireResourceId(chooser.instance(), file.fileRef()))
          .writeString(file.path())
          .writeString(file.name());
    }
    send(CHOOSE_COMPLETE, params);
  }

  private void onChooseComplete(ParamReader params) {
    WireResourceId chooserId = params.readResource();
    int result = params.readInt();
    int count = params.readInt();
    List<WireFile> files = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      files.add(new WireFile(params.readResource(), params.readString(), params.readString()));
    }
    FileChooser chooser = tracker().getAs(tracker().lookupByIdentity(chooserId), FileChooser.class);
    if (chooser == null) {
      // nobody will collect these, hand the references straight back
      debug(LOGGER, "Chosen files for unknown chooser " + chooserId + " returned to the host");
      CoreProxy core = dispatcher.getProxy(ApiGroup.CORE, CoreProxy.class);
      for (WireFile file : files) {
        if (!file.id().isNull()) {
          core.releaseResource(file.id());
        }
      }
      dispatcher.getCallbackTracker().complete(CallbackKey.single(chooserId, SHOW), result);
      return;
    }
    chooser.releaseChosenFiles(tracker());
    for (WireFile file : files) {
      int handle = adoptResource(file.id(), id -> new FileRef(id, file.path(), file.name()));
      if (handle != 0) {
        chooser.addChosenFile(handle);
      }
    }
    dispatcher.getCallbackTracker().complete(CallbackKey.single(chooserId, SHOW), result);
  }
}
