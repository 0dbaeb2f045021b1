package com.hotpreview.core.events;

import com.hotpreview.core.config.PreviewProperties;
import com.hotpreview.core.metrics.PreviewMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out of {@link PreviewMessage}s to live client channels.
 * <p>
 * Channels are either bound to one registered project or global (catalogue only).
 * Publishing only queues into each channel's bounded mailbox, so a slow or dead client
 * never blocks the publisher. Project groups exist between {@link #openProject} and
 * {@link #closeProject}; channels for a project outside that window are rejected.
 * <p>
 * Delivery threads are not bounded: a client whose transport blocks ties up only the thread
 * draining its own channel, never delivery to other channels.
 */
@Service
public class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final int mailboxCapacity;
    private final int maxChannelsPerProject;
    private final PreviewMetrics metrics;
    private final ExecutorService deliveryExecutor;

    /** All open channels keyed by channel id. */
    private final ConcurrentHashMap<String, ClientChannel> channels = new ConcurrentHashMap<>();

    /** Channel groups of currently registered projects. */
    private final ConcurrentHashMap<String, ProjectGroup> projectGroups = new ConcurrentHashMap<>();

    /** Catalogue subscribers. */
    private final CopyOnWriteArrayList<ClientChannel> globalChannels = new CopyOnWriteArrayList<>();

    @Autowired
    public BroadcastHub(PreviewProperties properties, @Autowired(required = false) PreviewMetrics metrics) {
        this(properties.getBroadcast().getMailboxCapacity(),
                properties.getBroadcast().getMaxChannelsPerProject(),
                metrics);
    }

    public BroadcastHub(int mailboxCapacity, int maxChannelsPerProject, PreviewMetrics metrics) {
        this.mailboxCapacity = mailboxCapacity;
        this.maxChannelsPerProject = maxChannelsPerProject;
        this.metrics = metrics;
        AtomicInteger counter = new AtomicInteger();
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "broadcast-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts accepting channels for a project. Idempotent.
     */
    public void openProject(String projectId) {
        projectGroups.computeIfAbsent(projectId, ProjectGroup::new);
        log.debug("Opened channel group for project {}", projectId);
    }

    public boolean isProjectOpen(String projectId) {
        return projectGroups.containsKey(projectId);
    }

    public ChannelHandle subscribe(String channelId, String projectId, ChannelSink sink) {
        return subscribe(channelId, projectId, sink, null);
    }

    /**
     * Opens a channel.
     *
     * @param channelId unique channel id
     * @param projectId project to bind to, or {@code null} for a global catalogue subscriber
     * @param sink      transport end
     * @param greeting  optional first message (state snapshot), delivered before any published event
     * @throws ChannelRejectedException if the project is not registered or its channel limit is reached
     */
    public ChannelHandle subscribe(String channelId, String projectId, ChannelSink sink, PreviewMessage greeting) {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(sink, "sink");
        if (greeting != null && projectId == null && !greeting.type().isCatalogue()) {
            throw new IllegalArgumentException("global channels only receive catalogue messages");
        }
        String scope = projectId == null ? "global" : "project";
        ClientChannel channel = new ClientChannel(channelId, projectId, sink, mailboxCapacity, deliveryExecutor,
                () -> recordDrop(scope), this::onChannelClosed);
        if (channels.putIfAbsent(channelId, channel) != null) {
            throw new ChannelRejectedException(ChannelRejectedException.Reason.DUPLICATE_ID,
                    "Channel id already in use: " + channelId);
        }
        if (projectId == null) {
            if (greeting != null) {
                channel.offer(greeting);
            }
            globalChannels.add(channel);
            log.debug("Global channel {} subscribed", channelId);
            return new ChannelHandle(channelId, null);
        }

        ProjectGroup group = projectGroups.get(projectId);
        ChannelRejectedException rejection = group == null ? notRegistered(projectId) : group.add(channel, greeting);
        if (rejection != null) {
            channels.remove(channelId, channel);
            throw rejection;
        }
        log.debug("Channel {} subscribed to project {}", channelId, projectId);
        return new ChannelHandle(channelId, projectId);
    }

    /**
     * Closes a channel, discarding undelivered messages. Safe to call more than once.
     */
    public void unsubscribe(ChannelHandle handle) {
        ClientChannel channel = channels.get(handle.channelId());
        if (channel != null) {
            channel.close();
        }
    }

    /**
     * Queues a message for every channel bound to {@code projectId}. Never blocks.
     */
    public void publish(String projectId, PreviewMessage message) {
        ProjectGroup group = projectGroups.get(projectId);
        if (group == null) {
            log.debug("Dropping {} for unregistered project {}", message.type(), projectId);
            return;
        }
        for (ClientChannel channel : group.channels) {
            channel.offer(message);
        }
    }

    /**
     * Queues a catalogue message for every global subscriber. Never blocks.
     *
     * @throws IllegalArgumentException for per-project message types
     */
    public void publishGlobal(PreviewMessage message) {
        if (!message.type().isCatalogue()) {
            throw new IllegalArgumentException(message.type().wireName() + " is not a catalogue message");
        }
        for (ClientChannel channel : globalChannels) {
            channel.offer(message);
        }
    }

    /**
     * Stops accepting channels for a project and force-closes the bound ones, each receiving
     * {@code finalMessage} after whatever was already queued.
     */
    public void closeProject(String projectId, PreviewMessage finalMessage) {
        ProjectGroup group = projectGroups.remove(projectId);
        if (group == null) {
            return;
        }
        List<ClientChannel> toClose = group.seal();
        for (ClientChannel channel : toClose) {
            channel.closeWith(finalMessage);
        }
        log.info("Closed {} channel(s) of project {}", toClose.size(), projectId);
    }

    public int channelCount() {
        return channels.size();
    }

    public int channelCount(String projectId) {
        if (projectId == null) {
            return globalChannels.size();
        }
        ProjectGroup group = projectGroups.get(projectId);
        return group == null ? 0 : group.channels.size();
    }

    @PreDestroy
    public void shutdown() {
        for (ClientChannel channel : new ArrayList<>(channels.values())) {
            channel.close();
        }
        projectGroups.clear();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Broadcast hub stopped");
    }

    private void onChannelClosed(ClientChannel channel) {
        channels.remove(channel.id(), channel);
        if (channel.projectId() == null) {
            globalChannels.remove(channel);
        } else {
            ProjectGroup group = projectGroups.get(channel.projectId());
            if (group != null) {
                group.channels.remove(channel);
            }
        }
        log.debug("Channel {} closed", channel.id());
    }

    private static ChannelRejectedException notRegistered(String projectId) {
        return new ChannelRejectedException(ChannelRejectedException.Reason.PROJECT_NOT_REGISTERED,
                "Project not registered: " + projectId);
    }

    private void recordDrop(String scope) {
        if (metrics != null) {
            metrics.recordBroadcastDrop(scope);
        }
    }

    /**
     * Channels of one project. Sealing and adding are mutually exclusive so no channel can
     * slip into a group after its project was removed.
     */
    private final class ProjectGroup {
        private final String projectId;
        private final CopyOnWriteArrayList<ClientChannel> channels = new CopyOnWriteArrayList<>();
        private boolean sealed;

        ProjectGroup(String projectId) {
            this.projectId = projectId;
        }

        synchronized ChannelRejectedException add(ClientChannel channel, PreviewMessage greeting) {
            if (sealed) {
                return notRegistered(projectId);
            }
            if (channels.size() >= maxChannelsPerProject) {
                return new ChannelRejectedException(ChannelRejectedException.Reason.LIMIT_REACHED,
                        "Channel limit (" + maxChannelsPerProject + ") reached for project " + projectId);
            }
            // greeting goes in before the channel becomes visible to publishers
            if (greeting != null) {
                channel.offer(greeting);
            }
            channels.add(channel);
            return null;
        }

        synchronized List<ClientChannel> seal() {
            sealed = true;
            return new ArrayList<>(channels);
        }
    }
}
