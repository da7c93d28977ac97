package com.vertector.nats.jetstream;

import com.vertector.nats.consumer.DeliveredMessage;
import com.vertector.nats.consumer.PullCursor;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** {@link PullCursor} over a bound JetStream pull subscription. */
class JetStreamPullCursor implements PullCursor {

    private final JetStreamSubscription subscription;

    JetStreamPullCursor(JetStreamSubscription subscription) {
        this.subscription = subscription;
    }

    @Override
    public List<DeliveredMessage> fetch(int batchSize, Duration timeout) {
        List<Message> messages = subscription.fetch(batchSize, timeout);
        List<DeliveredMessage> delivered = new ArrayList<>(messages.size());
        for (Message message : messages) {
            delivered.add(new JetStreamDeliveredMessage(message));
        }
        return delivered;
    }

    @Override
    public boolean isActive() {
        return subscription.isActive();
    }

    @Override
    public void unsubscribe() {
        subscription.unsubscribe();
    }
}
