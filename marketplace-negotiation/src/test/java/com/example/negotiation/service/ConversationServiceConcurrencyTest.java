package com.example.negotiation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.negotiation.config.NegotiationProperties;
import com.example.negotiation.config.NegotiationSecurityProperties;
import com.example.negotiation.domain.AuthenticatedUser;
import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.MessageType;
import com.example.negotiation.event.ChatEventPublisher;
import com.example.negotiation.persistence.ConversationEntityMapper;
import com.example.negotiation.persistence.JpaConversationRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Drives the real JPA store from several threads; each test commits, so ids are randomized per run.
 */
@DataJpaTest
@Import({JpaConversationRepository.class, ConversationEntityMapper.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("ConversationService under concurrency")
class ConversationServiceConcurrencyTest {

    private static final int THREADS = 8;

    @Autowired
    private JpaConversationRepository repository;

    private final AtomicInteger registryLookups = new AtomicInteger();
    private ExecutorService executor;
    private SellerOfRecordResolver sellerResolver;
    private ConversationService service;
    private String productId;
    private String sellerId;

    @BeforeEach
    void setUp() {
        String run = UUID.randomUUID().toString().substring(0, 8);
        productId = "product-" + run;
        sellerId = "seller-" + run;

        NegotiationProperties properties = new NegotiationProperties();
        ConversationLocks locks = new InMemoryConversationLocks();
        RedisKeyFactory keyFactory = new RedisKeyFactory(properties);
        ChatEventPublisher publisher = mock(ChatEventPublisher.class);
        Clock clock = Clock.systemUTC();
        ListingRegistry registry = requested -> {
            registryLookups.incrementAndGet();
            return productId.equals(requested) ? Optional.of(sellerId) : Optional.empty();
        };
        sellerResolver = new SellerOfRecordResolver(registry, properties);
        service = new ConversationService(
                repository,
                new NegotiationEngine(properties),
                new AccessController(new NegotiationSecurityProperties()),
                new DeliveryNotifier(repository, publisher, locks, keyFactory, clock),
                sellerResolver,
                publisher,
                locks,
                keyFactory,
                properties,
                clock);
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        sellerResolver.shutdown();
    }

    @Test
    @DisplayName("concurrent first contact yields a single conversation")
    void concurrentGetOrCreate() throws Exception {
        AuthenticatedUser buyer = new AuthenticatedUser("buyer-" + UUID.randomUUID(), true);

        List<ConversationMetadata> results = runConcurrently(THREADS,
                attempt -> () -> service.getOrCreateConversation(buyer, productId));

        Set<String> ids = results.stream().map(ConversationMetadata::getId).collect(Collectors.toSet());
        assertThat(ids).hasSize(1);
        assertThat(repository.findByProductAndBuyer(productId, buyer.userId())).isPresent();
        assertThat(registryLookups.get()).isBetween(1, THREADS);
    }

    @Test
    @DisplayName("concurrent senders produce exactly the sequences 1..N")
    void concurrentAppendsAreGapless() throws Exception {
        AuthenticatedUser buyer = new AuthenticatedUser("buyer-" + UUID.randomUUID(), true);
        AuthenticatedUser seller = new AuthenticatedUser(sellerId, true);
        String conversationId = service.getOrCreateConversation(buyer, productId).getId();
        int perThread = 15;

        List<List<ChatMessage>> sent = runConcurrently(THREADS, attempt -> () -> {
            AuthenticatedUser sender = attempt % 2 == 0 ? buyer : seller;
            List<ChatMessage> stored = new ArrayList<>();
            for (int i = 0; i < perThread; i++) {
                stored.add(service.postMessage(sender, conversationId, MessageType.TEXT, "msg " + attempt + "/" + i, null));
            }
            return stored;
        });

        long total = (long) THREADS * perThread;
        List<Long> returnedSequences = sent.stream()
                .flatMap(List::stream)
                .map(ChatMessage::getSequence)
                .sorted()
                .toList();
        List<Long> expected = LongStream.rangeClosed(1, total).boxed().toList();
        assertThat(returnedSequences).isEqualTo(expected);
        assertThat(repository.getAllMessages(conversationId))
                .extracting(ChatMessage::getSequence)
                .containsExactlyElementsOf(expected);
        assertThat(repository.getConversation(conversationId).orElseThrow().getLastSequence()).isEqualTo(total);
    }

    private <T> List<T> runConcurrently(int tasks, TaskFactory<T> factory) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int attempt = 0; attempt < tasks; attempt++) {
            Callable<T> task = factory.create(attempt);
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(30, TimeUnit.SECONDS));
        }
        return results;
    }

    @FunctionalInterface
    private interface TaskFactory<T> {
        Callable<T> create(int attempt);
    }
}
