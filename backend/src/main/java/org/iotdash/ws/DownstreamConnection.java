package org.iotdash.ws;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A downstream connection and the topics it asked for. No topics means every topic.
 */
public class DownstreamConnection {
    private final DownstreamChannel channel;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();

    public DownstreamConnection(DownstreamChannel channel, Collection<String> initialTopics) {
        this.channel = channel;
        if (initialTopics != null) {
            subscriptions.addAll(initialTopics);
        }
    }

    public DownstreamChannel getChannel() {
        return channel;
    }

    public boolean wants(String topic) {
        return subscriptions.isEmpty() || subscriptions.contains(topic);
    }

    public void subscribe(String topic) {
        subscriptions.add(topic);
    }

    public void unsubscribe(String topic) {
        subscriptions.remove(topic);
    }

    public Set<String> getSubscriptions() {
        return new TreeSet<>(subscriptions);
    }
}
