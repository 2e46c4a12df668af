package io.github.panghy.pluginproxy.proxy;

import io.github.panghy.pluginproxy.callback.CallbackKey;
import io.github.panghy.pluginproxy.callback.ResultCode;
import io.github.panghy.pluginproxy.channel.Channel;
import io.github.panghy.pluginproxy.dispatch.Dispatcher;
import io.github.panghy.pluginproxy.error.HandleTransitException;
import io.github.panghy.pluginproxy.message.ApiGroup;
import io.github.panghy.pluginproxy.message.ParamReader;
import io.github.panghy.pluginproxy.message.ParamWriter;
import io.github.panghy.pluginproxy.message.WireMessage;
import io.github.panghy.pluginproxy.proxy.backend.AudioBackend;
import io.github.panghy.pluginproxy.resource.WireResourceId;
import io.github.panghy.pluginproxy.transit.ChannelHandle;
import io.github.panghy.pluginproxy.transit.HandleKind;
import io.github.panghy.pluginproxy.transit.HandleTransit;
import io.github.panghy.pluginproxy.transit.HandleTransitToken;
import io.github.panghy.pluginproxy.transit.SharedMemoryHandle;

import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Audio output. Creating an audio resource returns at once; the host sets up the stream
 * in the background and then sends the plugin a socket and a shared memory buffer for
 * the samples.
 *
 * <p>Whoever receives the stream handles owns them. The plugin closes them itself when
 * the audio resource is gone by the time they arrive or the host reports a failure.
 * The host closes the duplicates it made when the notification cannot be sent.</p>
 */
public class AudioProxy extends InterfaceProxy {

  private static final Logger LOGGER = Logger.getLogger(AudioProxy.class.getName());

  static final int CREATE = 1;
  static final int START_OR_STOP = 2;
  static final int NOTIFY_STREAM_CREATED = 3;

  public AudioProxy(Dispatcher dispatcher) {
    super(dispatcher);
  }

  @Override
  public ApiGroup getApiGroup() {
    return ApiGroup.AUDIO;
  }

  /**
   * Creates an audio output. Wait on {@link Audio#getStreamReady()} for the stream.
   *
   * @param instance         The instance
   * @param sampleRate       Samples per second
   * @param sampleFrameCount Frames per buffer
   * @return The audio handle, 0 on failure
   */
  public int create(int instance, int sampleRate, int sampleFrameCount) {
    if (!servesInstance(instance) || sampleRate <= 0 || sampleFrameCount <= 0) {
      return 0;
    }
    WireResourceId id = callSync(CREATE, new ParamWriter()
        .writeInt(instance)
        .writeInt(sampleRate)
        .writeInt(sampleFrameCount),
        ParamReader::readResource, WireResourceId.NULL);
    int handle = adoptResource(id, wireId -> new Audio(wireId, sampleRate, sampleFrameCount));
    Audio audio = tracker().getAs(handle, Audio.class);
    if (audio != null && audio.getStreamReady() == null) {
      audio.setStreamReady(dispatcher.getCallbackTracker()
          .register(CallbackKey.single(id, NOTIFY_STREAM_CREATED)));
    }
    return handle;
  }

  public boolean startPlayback(int audio) {
    return startOrStop(audio, true);
  }

  public boolean stopPlayback(int audio) {
    return startOrStop(audio, false);
  }

  private boolean startOrStop(int audio, boolean start) {
    Audio object = tracker().getAs(audio, Audio.class);
    if (object == null) {
      return false;
    }
    if (!send(START_OR_STOP, new ParamWriter().writeResource(object.getWireId()).writeBoolean(start))) {
      return false;
    }
    object.setPlaying(start);
    return true;
  }

  @Override
  public boolean onMessageReceived(WireMessage message, ParamWriter reply) {
    ParamReader params = message.reader();
    if (!dispatcher.isHost()) {
      if (message.getKind() != NOTIFY_STREAM_CREATED) {
        return false;
      }
      onStreamCreated(params);
      return true;
    }
    AudioBackend backend = backend(AudioBackend.class);
    switch (message.getKind()) {
      case CREATE:
        int instance = params.readInt();
        int sampleRate = params.readInt();
        int frames = params.readInt();
        int audio = backend == null ? 0
            : backend.create(instance, sampleRate, frames,
                (resource, result, socket, sharedMemory) ->
                    notifyStreamCreated(new WireResourceId(instance, resource), result, socket, sharedMemory));
        if (reply != null) {
          reply.writeResource(new WireResourceId(instance, audio));
        }
        return true;
      case START_OR_STOP:
        WireResourceId id = params.readResource();
        boolean start = params.readBoolean();
        if (backend != null) {
          boolean ok = start ? backend.startPlayback(id.hostResource()) : backend.stopPlayback(id.hostResource());
          if (!ok) {
            warn(LOGGER, "Backend could not " + (start ? "start" : "stop") + " " + id);
          }
        }
        return true;
      default:
        return false;
    }
  }

  private void notifyStreamCreated(WireResourceId id, int result, ChannelHandle socket,
                                   SharedMemoryHandle sharedMemory) {
    Channel channel = dispatcher.getChannel();
    HandleTransitToken socketToken = HandleTransitToken.invalid(HandleKind.SOCKET);
    HandleTransitToken memoryToken = HandleTransitToken.invalid(HandleKind.SHARED_MEMORY);
    int sharedMemorySize = 0;
    if (result == ResultCode.OK.getCode()) {
      socketToken = HandleTransit.share(socket, channel);
      memoryToken = HandleTransit.share(sharedMemory, channel);
      if (!socketToken.valid() || !memoryToken.valid()) {
        HandleTransit.revoke(socketToken, channel);
        HandleTransit.revoke(memoryToken, channel);
        result = ResultCode.FAILED.getCode();
      } else {
        sharedMemorySize = sharedMemory.size();
      }
    }
    boolean sent = send(NOTIFY_STREAM_CREATED, new ParamWriter()
        .writeResource(id)
        .writeInt(result)
        .writeToken(socketToken)
        .writeToken(memoryToken)
        .writeInt(sharedMemorySize));
    if (!sent) {
      debug(LOGGER, "Could not deliver stream of " + id + ", withdrawing its handles");
      HandleTransit.revoke(socketToken, channel);
      HandleTransit.revoke(memoryToken, channel);
    }
  }

  private void onStreamCreated(ParamReader params) {
    WireResourceId id = params.readResource();
    int result = params.readInt();
    HandleTransitToken socketToken = params.readToken();
    HandleTransitToken memoryToken = params.readToken();
    int sharedMemorySize = params.readInt();
    Channel channel = dispatcher.getChannel();

    ChannelHandle socket = null;
    SharedMemoryHandle sharedMemory = null;
    if (result == ResultCode.OK.getCode()) {
      try {
        socket = HandleTransit.claim(socketToken, channel, ChannelHandle.class);
      } catch (HandleTransitException e) {
        warn(LOGGER, "Bad stream socket for " + id, e);
        result = ResultCode.FAILED.getCode();
      }
      try {
        sharedMemory = HandleTransit.claim(memoryToken, channel, SharedMemoryHandle.class);
        if (sharedMemory.size() != sharedMemorySize) {
          throw new HandleTransitException("Shared memory is " + sharedMemory.size()
              + " bytes, expected " + sharedMemorySize);
        }
      } catch (HandleTransitException e) {
        warn(LOGGER, "Bad stream memory for " + id, e);
        result = ResultCode.FAILED.getCode();
      }
    } else {
      // a failed notification may still carry handles; they are parked until claimed
      HandleTransit.closeQuietly(HandleTransit.receive(socketToken, channel));
      HandleTransit.closeQuietly(HandleTransit.receive(memoryToken, channel));
    }
    Audio audio = tracker().getAs(tracker().lookupByIdentity(id), Audio.class);
    if (audio == null || result != ResultCode.OK.getCode()) {
      // nobody will use them, but they are ours to close
      HandleTransit.closeQuietly(socket);
      HandleTransit.closeQuietly(sharedMemory);
    } else {
      audio.setStream(socket, sharedMemory);
    }
    dispatcher.getCallbackTracker().complete(CallbackKey.single(id, NOTIFY_STREAM_CREATED), result);
  }
}
