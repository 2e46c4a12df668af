package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.CallbackKey;
import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.core.ResultFuture;
import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.backend.Graphics2DBackend;
import io.github.panghy.pluginproxy.resource.WireResourceId;
import io.github.panghy.pluginproxy.transit.HandleTransit;
import io.github.panghy.pluginproxy.transit.HandleTransitToken;
import io.github.panghy.pluginproxy.transit.SharedMemoryHandle;
import io.github.panghy.pluginproxy.transit.TransitHandle;

import java.io.IOException;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * 2D drawing surfaces. Images travel to the host in shared memory; a flush may be in
 * flight once per surface and is acknowledged when the host has painted.
 */
public class Graphics2DProxy extends InterfaceProxy {

  private static final Logger LOGGER = Logger.getLogger(Graphics2DProxy.class.getName());

  static final int CREATE = 1;
  static final int SCROLL = 2;
  static final int REPLACE_CONTENTS = 3;
  static final int FLUSH = 4;
  static final int FLUSH_ACK = 5;

  public Graphics2DProxy(Dispatcher dispatcher) {
    super(dispatcher);
  }

  @Override
  public ApiGroup getApiGroup() {
    return ApiGroup.GRAPHICS_2D;
  }

  /**
   * Creates a surface.
   *
   * @param instance The instance
   * @param width    Width in pixels
   * @param height   Height in pixels
   * @param opaque   Whether the surface has no alpha
   * @return The surface handle, 0 on failure
   */
  public int create(int instance, int width, int height, boolean opaque) {
    if (!servesInstance(instance) || width <= 0 || height <= 0) {
      return 0;
    }
    WireResourceId id = callSync(CREATE, new ParamWriter()
        .writeInt(instance)
        .writeInt(width)
        .writeInt(height)
        .writeBoolean(opaque),
        ParamReader::readResource, WireResourceId.NULL);
    return adoptResource(id, wireId -> new Graphics2D(wireId, width, height, opaque));
  }

  public int scroll(int graphics, int dx, int dy) {
    Graphics2D object = tracker().getAs(graphics, Graphics2D.class);
    if (object == null) {
      return ResultCode.BADRESOURCE.getCode();
    }
    boolean sent = send(SCROLL, new ParamWriter().writeResource(object.getWireId()).writeInt(dx).writeInt(dy));
    return sent ? ResultCode.OK.getCode() : ResultCode.FAILED.getCode();
  }

  /**
   * Replaces the surface contents with an image. The host receives its own descriptor
   * for the image memory; the caller keeps and still owns {@code image}.
   *
   * @param graphics The surface handle
   * @param image    The image memory
   * @param width    Image width in pixels
   * @param height   Image height in pixels
   * @return OK, or an error code if the image could not be handed to the host
   */
  public int replaceContents(int graphics, SharedMemoryHandle image, int width, int height) {
    Graphics2D object = tracker().getAs(graphics, Graphics2D.class);
    if (object == null) {
      return ResultCode.BADRESOURCE.getCode();
    }
    if (image == null || width <= 0 || height <= 0) {
      return ResultCode.BADARGUMENT.getCode();
    }
    HandleTransitToken token = HandleTransit.share(image, dispatcher.getChannel());
    if (!token.valid()) {
      return ResultCode.FAILED.getCode();
    }
    boolean sent = send(REPLACE_CONTENTS, new ParamWriter()
        .writeResource(object.getWireId())
        .writeInt(width)
        .writeInt(height)
        .writeToken(token));
    if (!sent) {
      HandleTransit.revoke(token, dispatcher.getChannel());
      return ResultCode.FAILED.getCode();
    }
    return ResultCode.OK.getCode();
  }

  /**
   * Paints the pending changes.
   *
   * @param graphics The surface handle
   * @return Completes once painted; INPROGRESS at once if a flush is already pending
   */
  public ResultFuture<Integer> flush(int graphics) {
    Graphics2D object = tracker().getAs(graphics, Graphics2D.class);
    if (object == null) {
      return ResultFuture.completed(ResultCode.BADRESOURCE.getCode());
    }
    CallbackKey key = CallbackKey.single(object.getWireId(), FLUSH);
    if (dispatcher.getCallbackTracker().isPending(key)) {
      return ResultFuture.completed(ResultCode.INPROGRESS.getCode());
    }
    return sendAsync(key, FLUSH, new ParamWriter().writeResource(object.getWireId()), null);
  }

  @Override
  public boolean onMessageReceived(WireMessage message, ParamWriter reply) {
    ParamReader params = message.reader();
    if (!dispatcher.isHost()) {
      if (message.getKind() != FLUSH_ACK) {
        return false;
      }
      WireResourceId id = params.readResource();
      dispatcher.getCallbackTracker().complete(CallbackKey.single(id, FLUSH), params.readInt());
      return true;
    }
    Graphics2DBackend backend = backend(Graphics2DBackend.class);
    WireResourceId id;
    switch (message.getKind()) {
      case CREATE:
        int instance = params.readInt();
        int width = params.readInt();
        int height = params.readInt();
        boolean opaque = params.readBoolean();
        int graphics = backend == null ? 0 : backend.create(instance, width, height, opaque);
        if (reply != null) {
          reply.writeResource(new WireResourceId(instance, graphics));
        }
        return true;
      case SCROLL:
        id = params.readResource();
        int dx = params.readInt();
        int dy = params.readInt();
        if (backend != null) {
          backend.scroll(id.hostResource(), dx, dy);
        }
        return true;
      case REPLACE_CONTENTS:
        id = params.readResource();
        int imageWidth = params.readInt();
        int imageHeight = params.readInt();
        replaceContentsOnHost(backend, id, imageWidth, imageHeight, params.readToken());
        return true;
      case FLUSH:
        WireResourceId target = params.readResource();
        if (backend == null) {
          sendFlushAck(target, ResultCode.NOINTERFACE.getCode());
        } else {
          runBackend(callback -> backend.flush(target.hostResource(), callback),
              result -> sendFlushAck(target, result));
        }
        return true;
      default:
        return false;
    }
  }

  private void replaceContentsOnHost(Graphics2DBackend backend, WireResourceId id, int width, int height,
                                     HandleTransitToken token) {
    // the handle is ours from here on, whether or not it gets used
    TransitHandle handle = HandleTransit.receive(token, dispatcher.getChannel());
    try {
      if (!(handle instanceof SharedMemoryHandle)) {
        warn(LOGGER, "ReplaceContents for " + id + " without image memory");
        return;
      }
      if (backend == null) {
        return;
      }
      if (!backend.replaceContents(id.hostResource(), ((SharedMemoryHandle) handle).map(), width, height)) {
        warn(LOGGER, "Backend refused image for " + id);
      }
    } catch (IOException e) {
      warn(LOGGER, "Cannot map image memory for " + id, e);
    } finally {
      HandleTransit.closeQuietly(handle);
    }
  }

  private void sendFlushAck(WireResourceId id, int result) {
    send(FLUSH_ACK, new ParamWriter().writeResource(id).writeInt(result));
  }
}
