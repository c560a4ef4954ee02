package com.autocoin.application.channel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One-to-many distribution point: every published message is delivered to every
 * subscriber's own bounded channel.
 *
 * Publishing blocks while any subscriber's buffer is full, so a message is never
 * skipped for one consumer because another is slow. Subscribe before publishing
 * starts; late subscribers only see later messages.
 */
public final class Broadcaster<T> {

    private final String name;
    private final List<BoundedChannel<T>> subscribers = new CopyOnWriteArrayList<>();

    public Broadcaster(String name) {
        this.name = name;
    }

    /**
     * Register a consumer with its own buffer.
     */
    public BoundedChannel<T> subscribe(String subscriberName, int capacity) {
        BoundedChannel<T> channel = new BoundedChannel<>(name + "->" + subscriberName, capacity);
        subscribers.add(channel);
        return channel;
    }

    /**
     * Deliver to every subscriber, in subscription order.
     */
    public void publish(T message) throws InterruptedException {
        for (BoundedChannel<T> subscriber : subscribers) {
            subscriber.send(message);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public String name() {
        return name;
    }
}
