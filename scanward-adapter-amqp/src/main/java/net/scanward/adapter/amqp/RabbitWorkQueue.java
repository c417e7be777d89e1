package net.scanward.adapter.amqp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import net.scanward.core.model.DispatchMessage;
import net.scanward.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Work queue on a durable RabbitMQ queue, default exchange, routing key = queue name.
 * Messages are persistent JSON; publish returns only after the broker confirmed the message.
 *
 * <p>Channels are not thread-safe, so each publish borrows a channel of its own from a small
 * idle pool and opens a new one when the pool is empty. Concurrent publishes never wait on
 * each other's confirms. A channel that failed is aborted instead of going back to the pool.
 */
public final class RabbitWorkQueue implements WorkQueue, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RabbitWorkQueue.class);

    static final String CONTENT_TYPE = "application/json";
    static final int PERSISTENT = 2;
    static final int DEFAULT_MAX_IDLE_CHANNELS = 8;

    private final Connection connection;
    private final String queueName;
    private final Duration confirmTimeout;
    private final ObjectMapper json;
    private final int maxIdleChannels;

    private final Deque<Channel> idle = new ConcurrentLinkedDeque<>();
    private final AtomicInteger idleCount = new AtomicInteger();
    private volatile boolean closed;

    public RabbitWorkQueue(Connection connection, String queueName, Duration confirmTimeout, ObjectMapper json) {
        this(connection, queueName, confirmTimeout, json, DEFAULT_MAX_IDLE_CHANNELS);
    }

    public RabbitWorkQueue(Connection connection, String queueName, Duration confirmTimeout, ObjectMapper json,
                           int maxIdleChannels) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        this.confirmTimeout = confirmTimeout;
        this.json = json;
        this.maxIdleChannels = Math.max(1, maxIdleChannels);
    }

    @Override
    public void publish(DispatchMessage message) throws Exception {
        if (closed) throw new IllegalStateException("work queue is closed");
        byte[] body = encode(message);
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .contentType(CONTENT_TYPE)
                .deliveryMode(PERSISTENT)
                .messageId(message.id().toString())
                .build();
        Channel ch = borrow();
        try {
            ch.basicPublish("", queueName, props, body);
            ch.waitForConfirmsOrDie(confirmTimeout.toMillis());
        } catch (InterruptedException e) {
            // 확인 대기 중 인터럽트: 채널 상태를 알 수 없으니 버린다
            abort(ch);
            Thread.currentThread().interrupt();
            throw e;
        } catch (IOException | TimeoutException | RuntimeException e) {
            // 채널이 닫혔을 수 있으니 다음 발행에서 새로 연다
            abort(ch);
            throw e;
        }
        giveBack(ch);
        log.debug("Published dispatch message: id={} queue={}", message.id(), queueName);
    }

    byte[] encode(DispatchMessage message) throws IOException {
        ObjectNode node = json.createObjectNode();
        node.put("id", message.id().toString());
        node.put("target", message.target());
        return json.writeValueAsBytes(node);
    }

    private Channel borrow() throws IOException {
        Channel ch;
        while ((ch = idle.pollFirst()) != null) {
            idleCount.decrementAndGet();
            if (ch.isOpen()) return ch;
        }
        ch = connection.createChannel();
        try {
            ch.queueDeclare(queueName, true, false, false, null);
            ch.confirmSelect();
        } catch (IOException | RuntimeException e) {
            abort(ch);
            throw e;
        }
        log.info("Work queue channel opened: queue={}", queueName);
        return ch;
    }

    private void giveBack(Channel ch) {
        if (!closed) {
            if (idleCount.incrementAndGet() <= maxIdleChannels) {
                idle.offerFirst(ch);
                if (closed) close(); // close() 와 경합한 경우 다시 비운다
                return;
            }
            idleCount.decrementAndGet();
        }
        abort(ch);
    }

    private static void abort(Channel ch) {
        if (ch != null && ch.isOpen()) {
            try {
                ch.abort();
            } catch (IOException e) {
                log.debug("Channel abort failed", e);
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        Channel ch;
        while ((ch = idle.pollFirst()) != null) {
            idleCount.decrementAndGet();
            abort(ch);
        }
    }
}
