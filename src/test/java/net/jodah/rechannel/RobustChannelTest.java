package net.jodah.rechannel;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotSame;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;

import net.jodah.concurrentunit.Waiter;
import net.jodah.rechannel.event.DefaultChannelListener;

import org.mockito.InOrder;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.annotations.Test;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownListener;

@Test
public class RobustChannelTest extends AbstractChannelTest {
  public void shouldOpenThenApplyDefaultQosOnInitialize() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1);

    assertSame(channel.initialize(null), channel);

    InOrder inOrder = inOrder(mockSession.session);
    inOrder.verify(mockSession.session).open(eq(connection), eq(1), any(ShutdownListener.class));
    inOrder.verify(mockSession.session).basicQos(0, 0, false, null);
    assertEquals(channel.getChannelNumber(), 1);
  }

  public void shouldAdoptChannelNumberAssignedByConnection() throws Throwable {
    MockSession mockSession = mockSession(7);
    RobustChannel channel = channelFor(mockSession, 0);

    channel.initialize(null);

    verify(mockSession.session).open(eq(connection), eq(0), any(ShutdownListener.class));
    assertEquals(channel.getChannelNumber(), 7);
  }

  public void shouldCloseOnlyOnce() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);

    channel.close();
    channel.close();

    verify(mockSession.session, times(1)).close();
    verify(mockSession.session, times(1)).release();
    assertTrue(channel.isClosed());
    assertFalse(channel.isOpen());
    assertTrue(channel.getClosing().isDone());
  }

  public void shouldReplayLastRequestedQosOnReconnect() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    channel.setQos(5, 10, false, null);
    channel.setQos(7, 0, false, null);

    Connection newConnection = mockConnection("cxn-2");
    channel.onReconnect(newConnection, 1);

    InOrder inOrder = inOrder(mockSession.session);
    inOrder.verify(mockSession.session).open(eq(newConnection), eq(1),
        any(ShutdownListener.class));
    inOrder.verify(mockSession.session).basicQos(7, 0, false, null);
    verify(mockSession.session, times(2)).basicQos(7, 0, false, null);
    assertEquals(channel.getPrefetchCount(), 7);
    assertEquals(channel.getPrefetchSize(), 0);
  }

  public void shouldReplayDefaultQosWhenReconnectedRightAfterCreation() throws Throwable {
    MockSession mockSession = mockSession(3);
    RobustChannel channel = channelFor(mockSession, 3);

    Connection newConnection = mockConnection("cxn-2");
    channel.onReconnect(newConnection, 3);

    InOrder inOrder = inOrder(mockSession.session);
    inOrder.verify(mockSession.session).open(eq(newConnection), eq(3),
        any(ShutdownListener.class));
    inOrder.verify(mockSession.session).basicQos(0, 0, false, null);
  }

  public void shouldReplayQosWhoseRequestFailed() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    doThrow(new ConnectionLostException("lost")).doNothing()
        .when(mockSession.session)
        .basicQos(3, 0, false, null);

    try {
      channel.setQos(3);
      fail("Expected the QoS request to fail");
    } catch (ConnectionLostException expected) {
    }

    channel.onReconnect(mockConnection("cxn-2"), 1);
    verify(mockSession.session, times(2)).basicQos(3, 0, false, null);
  }

  public void shouldRejectQosForAllChannels() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    channel.setQos(2, 0, false, null);

    try {
      channel.setQos(1, 0, true, null);
      fail("Expected QoS for all channels to be rejected");
    } catch (UnsupportedOperationException expected) {
    }

    assertEquals(channel.getPrefetchCount(), 2);
    verify(mockSession.session, never()).basicQos(eq(1), anyInt(), anyBoolean(), any());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectNegativePrefetchCount() throws Throwable {
    channelFor(mockSession(1), 1).setQos(-1, 0, false, null);
  }

  public void shouldOnlyRememberRecoverableExternalExchanges() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);

    channel.declareExchange(new ExchangeDeclaration("e").withInternal(true));
    channel.declareExchange(new ExchangeDeclaration("f"), null, false);
    Exchange g = channel.declareExchange("g", BuiltinExchangeType.TOPIC);

    assertEquals(new ArrayList<String>(channel.getRecoverableExchanges().keySet()),
        Arrays.asList("g"));
    assertSame(channel.getRecoverableExchanges().get("g"), g);
    assertTrue(g instanceof RobustExchange);
    verify(mockSession.session).exchangeDeclare(
        new ExchangeDeclaration("g").withType(BuiltinExchangeType.TOPIC), null);
  }

  public void shouldRememberQueuesByResultingName() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);

    Queue named = channel.declareQueue("q");
    Queue generated = channel.declareQueue();
    channel.declareQueue(new QueueDeclaration("ephemeral"), null, false);

    assertEquals(generated.getName(), "amq.gen-1");
    assertEquals(new ArrayList<String>(channel.getRecoverableQueues().keySet()),
        Arrays.asList("q", "amq.gen-1"));
    assertSame(channel.getRecoverableQueues().get("q"), named);
    assertSame(channel.getRecoverableQueues().get("amq.gen-1"), generated);
  }

  public void shouldNotRememberEntitiesWhenRecoveryIsDisabled() throws Throwable {
    config.withExchangeRecovery(false).withQueueRecovery(false);
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);

    channel.declareExchange(new ExchangeDeclaration("x"));
    channel.declareQueue("q");

    assertTrue(channel.getRecoverableExchanges().isEmpty());
    assertTrue(channel.getRecoverableQueues().isEmpty());
  }

  public void shouldNotRedeclareDeletedEntitiesOnReconnect() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    channel.declareExchange(new ExchangeDeclaration("x"));
    channel.declareQueue("q");

    channel.exchangeDelete("x");
    assertNull(channel.queueDelete("q", false, false, true, null));
    channel.onReconnect(mockConnection("cxn-2"), 1);

    verify(mockSession.session, times(1)).exchangeDeclare(new ExchangeDeclaration("x"), null);
    verify(mockSession.session, times(1)).queueDeclare(new QueueDeclaration("q"), null);
    verify(mockSession.session).queueDelete("q", false, false, true, null);
  }

  public void shouldForgetDeletedEntitiesThatWereNeverRemembered() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    channel.declareExchange(new ExchangeDeclaration("x"));

    channel.exchangeDelete("unknown", true, false, null);
    channel.queueDelete("unknown");

    assertEquals(channel.getRecoverableExchanges().size(), 1);
    verify(mockSession.session).exchangeDelete("unknown", true, false, null);
  }

  public void shouldRecoverExchangesBeforeQueues() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    Queue y = channel.declareQueue("y");
    Exchange x = channel.declareExchange(new ExchangeDeclaration("x").withDurable(true));
    y.bind(x, "rk");

    Connection newConnection = mockConnection("cxn-2");
    channel.onReconnect(newConnection, 1);

    InOrder inOrder = inOrder(mockSession.session);
    inOrder.verify(mockSession.session).open(eq(newConnection), eq(1),
        any(ShutdownListener.class));
    inOrder.verify(mockSession.session).basicQos(0, 0, false, null);
    inOrder.verify(mockSession.session).exchangeDeclare(
        new ExchangeDeclaration("x").withDurable(true), null);
    inOrder.verify(mockSession.session).queueDeclare(new QueueDeclaration("y"), null);
    inOrder.verify(mockSession.session).queueBind("y", "x", "rk", null, null);
  }

  public void shouldPropagateQueueRecoveryFailure() throws Throwable {
    MockSession mockSession = mockSession(1);
    final List<Throwable> failures = new ArrayList<Throwable>();
    config.withChannelListeners(new DefaultChannelListener() {
      @Override
      public void onRecoveryFailure(RobustChannel channel, Throwable failure) {
        failures.add(failure);
      }
    });
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    IOException rejection = new IOException("PRECONDITION_FAILED - inequivalent arg 'durable'");
    when(mockSession.session.queueDeclare(new QueueDeclaration("a"), null)).thenReturn(
        declareOk("a")).thenThrow(rejection);
    channel.declareQueue("a");
    channel.declareQueue("b");

    try {
      channel.onReconnect(mockConnection("cxn-2"), 1);
      fail("Expected recovery to fail");
    } catch (IOException e) {
      assertSame(e, rejection);
    }

    verify(mockSession.session, times(1)).queueDeclare(new QueueDeclaration("b"), null);
    assertEquals(failures, Arrays.asList(rejection));
  }

  public void shouldPropagateReopenFailure() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    channel.declareExchange(new ExchangeDeclaration("x"));
    Connection newConnection = mockConnection("cxn-2");
    IOException failure = new IOException("Channel number 1 is already in use");
    doThrow(failure).when(mockSession.session).open(eq(newConnection), eq(1),
        any(ShutdownListener.class));

    try {
      channel.onReconnect(newConnection, 1);
      fail("Expected recovery to fail");
    } catch (IOException e) {
      assertSame(e, failure);
    }

    verify(mockSession.session, times(1)).exchangeDeclare(new ExchangeDeclaration("x"), null);
  }

  public void shouldFailPendingOperationsAndClosingSignalOnReconnect() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    CompletableFuture<Void> closing = channel.getClosing();
    CompletableFuture<Object> pending = mockSession.operations.register(
        new CompletableFuture<Object>());

    channel.onReconnect(mockConnection("cxn-2"), 1);

    assertConnectionLost(pending);
    assertConnectionLost(closing);
    assertTrue(mockSession.operations.isEmpty());
    assertNotSame(channel.getClosing(), closing);
    assertFalse(channel.getClosing().isDone());
  }

  public void shouldNotResolveNewClosingSignalFromStaleHandle() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    ShutdownListener staleListener = mockSession.shutdownListener;

    channel.onReconnect(mockConnection("cxn-2"), 1);
    mockSession.shutdownListener = staleListener;
    mockSession.shutdown(false);

    assertFalse(channel.getClosing().isDone());
  }

  public void shouldOnlyRejectOperationsOfReconnectedChannel() throws Throwable {
    MockSession sessionA = mockSession(1);
    MockSession sessionB = mockSession(2);
    RobustChannel channelA = channelFor(sessionA, 1).initialize(null);
    channelFor(sessionB, 2).initialize(null);
    CompletableFuture<Object> pendingA = sessionA.operations.register(
        new CompletableFuture<Object>());
    CompletableFuture<Object> pendingB = sessionB.operations.register(
        new CompletableFuture<Object>());

    channelA.onReconnect(mockConnection("cxn-2"), 1);

    assertConnectionLost(pendingA);
    assertFalse(pendingB.isDone());
    assertEquals(connectionOperations.size(), 1);
  }

  public void shouldNotReopenClosedChannelOnReconnect() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    channel.declareQueue("q");
    channel.close();

    channel.onReconnect(mockConnection("cxn-2"), 1);

    verify(mockSession.session, times(1)).open(any(Connection.class), anyInt(),
        any(ShutdownListener.class));
    verify(mockSession.session, times(1)).queueDeclare(new QueueDeclaration("q"), null);
    assertTrue(channel.isClosed());
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void shouldThrowOnDeclareAfterClose() throws Throwable {
    RobustChannel channel = channelFor(mockSession(1), 1).initialize(null);
    channel.close();
    channel.declareQueue("q");
  }

  public void shouldRekeyServerNamedQueueOnReconnect() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    Queue queue = channel.declareQueue();
    channel.declareQueue("named");

    channel.onReconnect(mockConnection("cxn-2"), 1);

    assertEquals(queue.getName(), "amq.gen-2");
    assertSame(channel.getRecoverableQueues().get("amq.gen-2"), queue);
    assertFalse(channel.getRecoverableQueues().containsKey("amq.gen-1"));

    channel.queueDelete("amq.gen-2");
    assertEquals(new ArrayList<String>(channel.getRecoverableQueues().keySet()),
        Arrays.asList("named"));
  }

  public void shouldNotifyListenersOfRecovery() throws Throwable {
    final List<String> events = new ArrayList<String>();
    config.withChannelListeners(new DefaultChannelListener() {
      @Override
      public void onRecoveryStarted(RobustChannel channel) {
        events.add("started");
      }

      @Override
      public void onRecovery(RobustChannel channel) {
        events.add("recovered");
        throw new IllegalStateException("listener failures should not fail recovery");
      }

      @Override
      public void onRecoveryCompleted(RobustChannel channel) {
        events.add("completed");
      }
    });
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1).initialize(null);

    channel.onReconnect(mockConnection("cxn-2"), 1);

    assertEquals(events, Arrays.asList("started", "recovered", "completed"));
  }

  public void closeShouldFailWhenConnectionIsReplacedWhileClosing() throws Throwable {
    MockSession mockSession = mockSession(1);
    final RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    doNothing().when(mockSession.session).close();
    final Waiter waiter = new Waiter();

    new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          channel.close();
          waiter.fail("Close should have failed");
        } catch (ConnectionLostException expected) {
          waiter.resume();
        } catch (Throwable t) {
          waiter.fail(t);
        }
      }
    }).start();

    while (!channel.isClosed())
      Thread.sleep(10);
    channel.onReconnect(mockConnection("cxn-2"), 1);
    waiter.await(5000);

    verify(mockSession.session).release();
    verify(mockSession.session, times(1)).open(any(Connection.class), anyInt(),
        any(ShutdownListener.class));
  }

  public void closeShouldReturnAfterFailedReopen() throws Throwable {
    MockSession mockSession = mockSession(1);
    final RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    Connection newConnection = mockConnection("cxn-2");
    doThrow(new IOException("refused")).when(mockSession.session)
        .open(eq(newConnection), eq(1), any(ShutdownListener.class));

    try {
      channel.onReconnect(newConnection, 1);
      fail("Expected the reopen to fail");
    } catch (IOException expected) {
    }

    closeWithin(channel, 5000);

    assertTrue(channel.isClosed());
    assertTrue(channel.getClosing().isDone());
    verify(mockSession.session, never()).close();
    verify(mockSession.session).release();
  }

  public void closeShouldReturnAfterFailedInitialize() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1);
    doThrow(new IOException("No channel numbers")).when(mockSession.session)
        .open(eq(connection), eq(1), any(ShutdownListener.class));

    try {
      channel.initialize(null);
      fail("Expected the open to fail");
    } catch (IOException expected) {
    }

    closeWithin(channel, 5000);

    assertTrue(channel.isClosed());
    verify(mockSession.session, never()).close();
  }

  public void closeShouldWaitForConcurrentRecoveryThenCloseRecoveredHandle() throws Throwable {
    final MockSession mockSession = mockSession(1);
    final RobustChannel channel = channelFor(mockSession, 1).initialize(null);
    channel.declareQueue("q");
    final Connection newConnection = mockConnection("cxn-2");
    final CountDownLatch opening = new CountDownLatch(1);
    final CountDownLatch openAllowed = new CountDownLatch(1);
    doAnswer(new Answer<Void>() {
      @Override
      public Void answer(InvocationOnMock invocation) throws Throwable {
        mockSession.shutdownListener = invocation.getArgument(2);
        opening.countDown();
        openAllowed.await();
        return null;
      }
    }).when(mockSession.session).open(eq(newConnection), eq(1), any(ShutdownListener.class));
    final Waiter waiter = new Waiter();

    new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          channel.onReconnect(newConnection, 1);
          waiter.resume();
        } catch (Throwable t) {
          waiter.fail(t);
        }
      }
    }).start();
    opening.await();

    new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          channel.close();
          waiter.resume();
        } catch (Throwable t) {
          waiter.fail(t);
        }
      }
    }).start();

    Thread.sleep(200);
    assertFalse(channel.isClosed());
    openAllowed.countDown();
    waiter.await(5000, 2);

    assertTrue(channel.isClosed());
    InOrder inOrder = inOrder(mockSession.session);
    inOrder.verify(mockSession.session).open(eq(newConnection), eq(1),
        any(ShutdownListener.class));
    inOrder.verify(mockSession.session).queueDeclare(new QueueDeclaration("q"), null);
    inOrder.verify(mockSession.session).close();
    inOrder.verify(mockSession.session).release();

    channel.onReconnect(mockConnection("cxn-3"), 1);
    verify(mockSession.session, times(2)).open(any(Connection.class), anyInt(),
        any(ShutdownListener.class));
    verify(mockSession.session, times(2)).queueDeclare(new QueueDeclaration("q"), null);
  }

  public void shouldPassTimeoutsThrough() throws Throwable {
    MockSession mockSession = mockSession(1);
    RobustChannel channel = channelFor(mockSession, 1);
    Duration timeout = Duration.ofSeconds(3);

    channel.initialize(timeout);
    channel.declareQueue(new QueueDeclaration("q"), timeout, true);

    verify(mockSession.session).basicQos(0, 0, false, timeout);
    verify(mockSession.session).queueDeclare(new QueueDeclaration("q"), timeout);
    verify(mockSession.session, never()).basicQos(anyInt(), anyInt(), anyBoolean(), isNull());
  }

  private static void closeWithin(final RobustChannel channel, long timeoutMillis)
      throws Throwable {
    final Waiter waiter = new Waiter();
    new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          channel.close();
          waiter.resume();
        } catch (Throwable t) {
          waiter.fail(t);
        }
      }
    }).start();
    waiter.await(timeoutMillis);
  }

  private static void assertConnectionLost(CompletableFuture<?> future) throws Exception {
    assertTrue(future.isCompletedExceptionally());
    try {
      future.get();
      fail("Expected future to fail");
    } catch (ExecutionException e) {
      assertTrue(e.getCause() instanceof ConnectionLostException, "Unexpected failure " + e);
    }
  }
}
