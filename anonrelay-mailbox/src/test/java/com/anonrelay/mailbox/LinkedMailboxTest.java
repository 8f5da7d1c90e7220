package com.anonrelay.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LinkedMailbox covering capacity limits, blocking put and close semantics.
 */
class LinkedMailboxTest {

    @Test
    void testOfferRejectsNull() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LinkedMailbox<String>(0));
    }

    @Test
    void testBasicOfferAndPoll() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();

        assertTrue(mailbox.offer("message1"));
        assertTrue(mailbox.offer("message2"));

        assertEquals("message1", mailbox.poll());
        assertEquals("message2", mailbox.poll());
        assertNull(mailbox.poll());
    }

    @Test
    void testBoundedCapacity() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(2);

        assertTrue(mailbox.offer("msg1"));
        assertTrue(mailbox.offer("msg2"));
        assertFalse(mailbox.offer("msg3"));
        assertEquals(2, mailbox.size());

        assertEquals("msg1", mailbox.poll());
        assertTrue(mailbox.offer("msg3"));
    }

    @Test
    @Timeout(5)
    void testPutSuspendsUntilSpaceIsAvailable() throws Exception {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(1);
        mailbox.put("first");

        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean delivered = new AtomicBoolean(false);
        Thread producer = new Thread(() -> {
            started.countDown();
            try {
                mailbox.put("second");
                delivered.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        started.await();

        Thread.sleep(100);
        assertFalse(delivered.get(), "put should block while the mailbox is full");

        assertEquals("first", mailbox.poll());
        producer.join(2000);
        assertTrue(delivered.get());
        assertEquals("second", mailbox.poll());
    }

    @Test
    void testClosedMailboxRejectsProducersButKeepsQueuedMessages() throws Exception {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(4);
        mailbox.put("queued");
        mailbox.close();

        assertTrue(mailbox.isClosed());
        assertFalse(mailbox.isDrained());
        assertThrows(MailboxClosedException.class, () -> mailbox.offer("late"));
        assertThrows(MailboxClosedException.class, () -> mailbox.put("late"));

        assertEquals("queued", mailbox.poll());
        assertTrue(mailbox.isDrained());
    }

    @Test
    @Timeout(5)
    void testCloseReleasesProducerBlockedOnFullMailbox() throws Exception {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(1);
        mailbox.put("fill");

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread producer = new Thread(() -> {
            try {
                mailbox.put("blocked");
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        producer.start();
        Thread.sleep(100);

        mailbox.close();
        producer.join(2000);

        assertInstanceOf(MailboxClosedException.class, failure.get());
    }

    @Test
    @Timeout(5)
    void testEnqueueRingsAttachedDoorbell() throws Exception {
        Doorbell doorbell = new Doorbell();
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(8, doorbell);

        assertFalse(doorbell.await(10, TimeUnit.MILLISECONDS));
        mailbox.offer("ding");
        assertTrue(doorbell.await(1, TimeUnit.SECONDS));
    }
}
