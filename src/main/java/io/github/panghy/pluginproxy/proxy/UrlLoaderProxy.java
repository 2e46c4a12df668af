package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.CallbackKey;
import io.github.panghy.pluginproxy.callback.CallbackTracker;
import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.backend.UrlLoaderBackend;
import io.github.panghy.pluginproxy.proxy.backend.UrlRequest;
import io.github.panghy.pluginproxy.resource.WireResourceId;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.function.IntConsumer;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Loading URLs from the plugin through the host's network stack.
 *
 * <p>Open, follow-redirect and finish-streaming-to-file may each be issued several times
 * on one loader, so their pending callbacks are keyed by a sequence number that the host
 * echoes in its {@code CALLBACK_COMPLETE} message. Reads allow a single request in
 * flight per loader.</p>
 *
 * <p>Response body reads are buffered on the plugin side. The host answers a read with
 * everything it can deliver without waiting, up to a limit, even when that is more than
 * was asked for; the surplus is kept in the {@link UrlLoader} and later reads are served
 * from it without a round trip.</p>
 *
 * <p>When constructed on the host side, the proxy registers itself as the backend's
 * progress listener and forwards every update to the plugin.</p>
 */
public class UrlLoaderProxy extends InterfaceProxy {

  private static final Logger LOGGER = Logger.getLogger(UrlLoaderProxy.class.getName());

  // plugin -> host
  static final int CREATE = 1;
  static final int OPEN = 2;
  static final int FOLLOW_REDIRECT = 3;
  static final int GET_RESPONSE_INFO = 4;
  static final int READ_RESPONSE_BODY = 5;
  static final int FINISH_STREAMING_TO_FILE = 6;
  static final int CLOSE = 7;
  // host -> plugin
  static final int READ_RESPONSE_BODY_ACK = 8;
  static final int UPDATE_PROGRESS = 9;
  static final int CALLBACK_COMPLETE = 10;

  public UrlLoaderProxy(Dispatcher dispatcher) {
    super(dispatcher);
    if (dispatcher.isHost()) {
      UrlLoaderBackend backend = backend(UrlLoaderBackend.class);
      if (backend != null) {
        backend.setStatusCallback(this::sendProgress);
      }
    }
  }

  @Override
  public ApiGroup getApiGroup() {
    return ApiGroup.URL_LOADER;
  }

  /**
   * Creates a loader for an instance.
   *
   * @param instance The instance
   * @return The loader handle, 0 on failure
   */
  public int create(int instance) {
    if (!servesInstance(instance)) {
      warn(LOGGER, "Cannot create a loader for unknown instance " + instance);
      return 0;
    }
    WireResourceId id = callSync(CREATE, new ParamWriter().writeInt(instance),
        ParamReader::readResource, WireResourceId.NULL);
    return adoptResource(id, UrlLoader::new);
  }

  /**
   * Starts loading a request.
   *
   * @param loader  The loader handle
   * @param request The request
   * @return Completes with the result once the response headers arrived
   */
  public ResultFuture<Integer> open(int loader, UrlRequest request) {
    UrlLoader object = tracker().getAs(loader, UrlLoader.class);
    if (object == null) {
      return ResultFuture.completed(ResultCode.BADRESOURCE.getCode());
    }
    if (request == null || request.url() == null) {
      return ResultFuture.completed(ResultCode.BADARGUMENT.getCode());
    }
    CallbackKey key = sequencedKey(object, OPEN);
    ParamWriter params = new ParamWriter()
        .writeResource(object.getWireId())
        .writeLong(key.sequence())
        .writeString(request.url())
        .writeString(request.method())
        .writeString(request.headers())
        .writeBoolean(request.followRedirects())
        .writeBoolean(request.recordUploadProgress())
        .writeBoolean(request.recordDownloadProgress());
    return sendAsync(key, OPEN, params, null);
  }

  public ResultFuture<Integer> followRedirect(int loader) {
    return simpleSequencedCall(loader, FOLLOW_REDIRECT);
  }

  public ResultFuture<Integer> finishStreamingToFile(int loader) {
    return simpleSequencedCall(loader, FINISH_STREAMING_TO_FILE);
  }

  private ResultFuture<Integer> simpleSequencedCall(int loader, int kind) {
    UrlLoader object = tracker().getAs(loader, UrlLoader.class);
    if (object == null) {
      return ResultFuture.completed(ResultCode.BADRESOURCE.getCode());
    }
    CallbackKey key = sequencedKey(object, kind);
    return sendAsync(key, kind, new ParamWriter().writeResource(object.getWireId()).writeLong(key.sequence()), null);
  }

  private CallbackKey sequencedKey(UrlLoader object, int kind) {
    return new CallbackKey(object.getWireId(), kind, dispatcher.getCallbackTracker().nextSequence());
  }

  /**
   * Gets the response info of a loader. The loader keeps its own reference and the
   * caller receives another one.
   *
   * @param loader The loader handle
   * @return The response info handle, 0 if there is no response yet
   */
  public int getResponseInfo(int loader) {
    UrlLoader object = tracker().getAs(loader, UrlLoader.class);
    if (object == null) {
      return 0;
    }
    if (object.getResponseInfo() == 0) {
      WireResourceId id = callSync(GET_RESPONSE_INFO, new ParamWriter().writeResource(object.getWireId()),
          ParamReader::readResource, WireResourceId.NULL);
      int handle = adoptResource(id, UrlResponseInfo::new);
      if (handle == 0) {
        return 0;
      }
      object.setResponseInfo(handle);
    }
    tracker().addRefResource(object.getResponseInfo());
    return object.getResponseInfo();
  }

  /**
   * Reads response body. If enough data is buffered the read completes immediately;
   * otherwise the host is asked for at least {@code bytesToRead} bytes and the read
   * completes when they arrive.
   *
   * @param loader      The loader handle
   * @param dest        Receives the data; must be writable
   * @param bytesToRead How many bytes to read; {@code dest} must have room for them
   * @return Completes with the number of bytes read (0 at end of stream) or an error
   *     code
   */
  public ResultFuture<Integer> readResponseBody(int loader, ByteBuffer dest, int bytesToRead) {
    UrlLoader object = tracker().getAs(loader, UrlLoader.class);
    if (object == null) {
      return ResultFuture.completed(ResultCode.BADRESOURCE.getCode());
    }
    if (dest == null || dest.isReadOnly() || bytesToRead <= 0 || dest.remaining() < bytesToRead) {
      return ResultFuture.completed(ResultCode.BADARGUMENT.getCode());
    }
    if (object.hasPendingRead()) {
      return ResultFuture.completed(ResultCode.INPROGRESS.getCode());
    }
    if (object.bufferedBytes() >= bytesToRead) {
      return ResultFuture.completed(object.takeFromBuffer(dest, bytesToRead));
    }
    object.setPendingRead(dest, bytesToRead);
    int requestSize = Math.max(bytesToRead, dispatcher.getConfiguration().getMinimumReadRequestSize());
    return sendAsync(CallbackKey.single(object.getWireId(), READ_RESPONSE_BODY), READ_RESPONSE_BODY,
        new ParamWriter().writeResource(object.getWireId()).writeInt(requestSize),
        object::finishPendingRead);
  }

  /**
   * Cancels the load. Pending operations complete through the host's callbacks.
   *
   * @param loader The loader handle
   */
  public void close(int loader) {
    UrlLoader object = tracker().getAs(loader, UrlLoader.class);
    if (object != null) {
      send(CLOSE, new ParamWriter().writeResource(object.getWireId()));
    }
  }

  /**
   * Gets the last upload progress the host reported.
   *
   * @param loader The loader handle
   * @return The progress, unknown if never reported or the handle is bad
   */
  public TransferProgress getUploadProgress(int loader) {
    UrlLoader object = tracker().getAs(loader, UrlLoader.class);
    return object == null ? TransferProgress.UNKNOWN : object.getUploadProgress();
  }

  public TransferProgress getDownloadProgress(int loader) {
    UrlLoader object = tracker().getAs(loader, UrlLoader.class);
    return object == null ? TransferProgress.UNKNOWN : object.getDownloadProgress();
  }

  @Override
  public boolean onMessageReceived(WireMessage message, ParamWriter reply) {
    ParamReader params = message.reader();
    if (dispatcher.isHost()) {
      return onHostMessage(message.getKind(), params, reply);
    }
    return onPluginMessage(message.getKind(), params);
  }

  // Host side

  private boolean onHostMessage(int kind, ParamReader params, ParamWriter reply) {
    UrlLoaderBackend backend = backend(UrlLoaderBackend.class);
    WireResourceId id;
    long sequence;
    switch (kind) {
      case CREATE:
        int instance = params.readInt();
        int loader = backend == null ? 0 : backend.create(instance);
        if (reply != null) {
          reply.writeResource(new WireResourceId(instance, loader));
        }
        return true;
      case OPEN:
        id = params.readResource();
        sequence = params.readLong();
        UrlRequest request = new UrlRequest(params.readString(), params.readString(), params.readString(),
            params.readBoolean(), params.readBoolean(), params.readBoolean());
        completeOnHost(backend, id, OPEN, sequence, (b, loaderId, callback) -> b.open(loaderId, request, callback));
        return true;
      case FOLLOW_REDIRECT:
        id = params.readResource();
        sequence = params.readLong();
        completeOnHost(backend, id, FOLLOW_REDIRECT, sequence, UrlLoaderBackend::followRedirect);
        return true;
      case FINISH_STREAMING_TO_FILE:
        id = params.readResource();
        sequence = params.readLong();
        completeOnHost(backend, id, FINISH_STREAMING_TO_FILE, sequence, UrlLoaderBackend::finishStreamingToFile);
        return true;
      case GET_RESPONSE_INFO:
        id = params.readResource();
        int info = backend == null ? 0 : backend.getResponseInfo(id.hostResource());
        if (reply != null) {
          reply.writeResource(new WireResourceId(id.instance(), info));
        }
        return true;
      case READ_RESPONSE_BODY:
        id = params.readResource();
        readOnHost(backend, id, params.readInt());
        return true;
      case CLOSE:
        id = params.readResource();
        if (backend != null) {
          backend.close(id.hostResource());
        }
        return true;
      default:
        return false;
    }
  }

  /**
   * An asynchronous loader operation on the backend.
   */
  @FunctionalInterface
  private interface LoaderCall {
    int start(UrlLoaderBackend backend, int loader, IntConsumer callback);
  }

  private void completeOnHost(UrlLoaderBackend backend, WireResourceId id, int operation, long sequence,
                              LoaderCall call) {
    if (backend == null) {
      sendCallbackComplete(id, operation, sequence, ResultCode.NOINTERFACE.getCode());
      return;
    }
    runBackend(callback -> call.start(backend, id.hostResource(), callback),
        result -> sendCallbackComplete(id, operation, sequence, result));
  }

  private void sendCallbackComplete(WireResourceId id, int operation, long sequence, int result) {
    boolean sent = send(CALLBACK_COMPLETE, new ParamWriter()
        .writeResource(id)
        .writeInt(operation)
        .writeLong(sequence)
        .writeInt(result));
    if (!sent) {
      debug(LOGGER, "Could not report result " + result + " of operation " + operation + " on " + id);
    }
  }

  private void readOnHost(UrlLoaderBackend backend, WireResourceId id, int bytesToRead) {
    if (backend == null || bytesToRead <= 0) {
      sendReadAck(id, backend == null ? ResultCode.NOINTERFACE.getCode() : ResultCode.BADARGUMENT.getCode(),
          new byte[0]);
      return;
    }
    // push ahead whatever is already available; neither the request nor the read-ahead
    // may exceed the configured cap
    int cap = dispatcher.getConfiguration().getMaxReadBufferSize();
    int available = Math.min(backend.getAvailableBytes(id.hostResource()), cap);
    ByteBuffer data = ByteBuffer.allocate(Math.max(Math.min(bytesToRead, cap), available));
    runBackend(callback -> backend.readResponseBody(id.hostResource(), data, callback),
        result -> sendReadAck(id, result, result > 0 ? Arrays.copyOf(data.array(), result) : new byte[0]));
  }

  private void sendReadAck(WireResourceId id, int result, byte[] data) {
    send(READ_RESPONSE_BODY_ACK, new ParamWriter().writeResource(id).writeInt(result).writeBytes(data));
  }

  private void sendProgress(int instance, int loader, long bytesSent, long totalBytesToBeSent,
                            long bytesReceived, long totalBytesToBeReceived) {
    send(UPDATE_PROGRESS, new ParamWriter()
        .writeResource(new WireResourceId(instance, loader))
        .writeLong(bytesSent)
        .writeLong(totalBytesToBeSent)
        .writeLong(bytesReceived)
        .writeLong(totalBytesToBeReceived));
  }

  // Plugin side

  private boolean onPluginMessage(int kind, ParamReader params) {
    CallbackTracker callbacks = dispatcher.getCallbackTracker();
    WireResourceId id;
    UrlLoader object;
    switch (kind) {
      case READ_RESPONSE_BODY_ACK:
        id = params.readResource();
        int result = params.readInt();
        byte[] data = params.readBytes();
        object = tracker().getAs(tracker().lookupByIdentity(id), UrlLoader.class);
        if (object == null) {
          debug(LOGGER, "Read data for unknown loader " + id + " dropped");
          return true;
        }
        if (!object.hasPendingRead() || !callbacks.isPending(CallbackKey.single(id, READ_RESPONSE_BODY))) {
          debug(LOGGER, "Read data for " + id + " arrived with no read outstanding, dropped");
          return true;
        }
        if (result > 0) {
          object.appendToBuffer(data);
        }
        callbacks.complete(CallbackKey.single(id, READ_RESPONSE_BODY), result);
        return true;
      case UPDATE_PROGRESS:
        id = params.readResource();
        TransferProgress upload = new TransferProgress(params.readLong(), params.readLong());
        TransferProgress download = new TransferProgress(params.readLong(), params.readLong());
        object = tracker().getAs(tracker().lookupByIdentity(id), UrlLoader.class);
        if (object != null) {
          object.setProgress(upload, download);
        }
        return true;
      case CALLBACK_COMPLETE:
        id = params.readResource();
        int operation = params.readInt();
        long sequence = params.readLong();
        callbacks.complete(new CallbackKey(id, operation, sequence), params.readInt());
        return true;
      default:
        return false;
    }
  }
}
