package com.saletracker.tracker.domain.subscription;

import static com.saletracker.tracker.test.fixtures.TrackerFixtures.DIRECT_SUBSCRIBER;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.GROUP_SUBSCRIBER;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.OTHER_APP_ID;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.OTHER_DIRECT_SUBSCRIBER;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.OTHER_NAME;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.SOME_APP_ID;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.SOME_NAME;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.SOME_REGION;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.monitoredItemBuilder;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.paidSnapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.saletracker.tracker.test.fixtures.InMemorySubscriptionRepository;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SubscriptionStoreTest {

    private InMemorySubscriptionRepository repository;
    private SubscriptionStore store;

    @BeforeEach
    void setUp() {
        repository = new InMemorySubscriptionRepository();
        store = new SubscriptionStore(repository);
    }

    @Nested
    class Subscribe {

        @Test
        void shouldCreateUninitializedItemOnFirstSubscription() {
            // when
            var outcome = store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);

            // then
            assertThat(outcome).isEqualTo(SubscribeOutcome.NEWLY_SUBSCRIBED);
            var expected = monitoredItemBuilder().build();
            assertThat(repository.stored()).containsExactlyEntriesOf(Map.of(SOME_APP_ID, expected));
            assertThat(expected.hasBaseline()).isFalse();
        }

        @Test
        void shouldBeIdempotentForSameAddress() {
            // given
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);
            var savesAfterFirst = repository.saveCount();

            // when
            var outcome = store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);

            // then
            assertThat(outcome).isEqualTo(SubscribeOutcome.ALREADY_SUBSCRIBED);
            assertThat(store.find(SOME_APP_ID)).map(MonitoredItem::subscribers).contains(List.of(DIRECT_SUBSCRIBER));
            assertThat(repository.saveCount()).isEqualTo(savesAfterFirst);
        }

        @Test
        void shouldAppendSubscribersInOrderAndKeepExistingPrice() {
            // given
            repository.seed(monitoredItemBuilder().lastPrice(paidSnapshot("59.99")).build());

            // when
            store.subscribe(SOME_APP_ID, SOME_NAME, "us", GROUP_SUBSCRIBER);

            // then
            var item = store.find(SOME_APP_ID).orElseThrow();
            assertThat(item.subscribers()).containsExactly(DIRECT_SUBSCRIBER, GROUP_SUBSCRIBER);
            assertThat(item.lastPrice()).isEqualTo(paidSnapshot("59.99"));
            assertThat(item.region()).isEqualTo(SOME_REGION);
        }
    }

    @Nested
    class Unsubscribe {

        @Test
        void shouldRemoveItemWhenLastSubscriberLeaves() {
            // given
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);

            // when
            var outcome = store.unsubscribe(SOME_APP_ID, DIRECT_SUBSCRIBER);

            // then
            assertThat(outcome).isEqualTo(UnsubscribeOutcome.REMOVED);
            assertThat(store.listAll()).isEmpty();
            assertThat(repository.stored()).isEmpty();
        }

        @Test
        void shouldKeepItemWhileOtherSubscribersRemain() {
            // given
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, OTHER_DIRECT_SUBSCRIBER);

            // when
            store.unsubscribe(SOME_APP_ID, DIRECT_SUBSCRIBER);

            // then
            assertThat(store.find(SOME_APP_ID))
                    .map(MonitoredItem::subscribers)
                    .contains(List.of(OTHER_DIRECT_SUBSCRIBER));
        }

        @Test
        void shouldReportNotSubscribedForNonMember() {
            // given
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);

            // when
            var outcome = store.unsubscribe(SOME_APP_ID, OTHER_DIRECT_SUBSCRIBER);

            // then
            assertThat(outcome).isEqualTo(UnsubscribeOutcome.NOT_SUBSCRIBED);
            assertThat(store.find(SOME_APP_ID)).isPresent();
        }

        @Test
        void shouldReportNotMonitoredForUnknownItem() {
            assertThat(store.unsubscribe(OTHER_APP_ID, DIRECT_SUBSCRIBER)).isEqualTo(UnsubscribeOutcome.NOT_MONITORED);
            assertThat(repository.saveCount()).isZero();
        }

        @Test
        void shouldMatchSequentialApplicationOfOperations() {
            // when
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);
            store.unsubscribe(SOME_APP_ID, DIRECT_SUBSCRIBER);
            store.unsubscribe(SOME_APP_ID, DIRECT_SUBSCRIBER);
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);

            // then
            assertThat(store.listByAddress(DIRECT_SUBSCRIBER)).extracting(MonitoredItem::appId).containsExactly(SOME_APP_ID);
        }
    }

    @Test
    void shouldReportStoredItemCountAfterRefreshWithoutOtherAccess() {
        // given
        repository.seed(
                monitoredItemBuilder().build(),
                monitoredItemBuilder().appId(OTHER_APP_ID).name(OTHER_NAME).build());
        assertThat(store.monitoredCount()).isZero();

        // when
        var count = store.refreshMonitoredCount();

        // then
        assertThat(count).isEqualTo(2);
        assertThat(store.monitoredCount()).isEqualTo(2);
        assertThat(repository.saveCount()).isZero();
    }

    @Nested
    class Listing {

        @Test
        void shouldListOnlyItemsOfAddressInInsertionOrder() {
            // given
            store.subscribe(OTHER_APP_ID, OTHER_NAME, SOME_REGION, DIRECT_SUBSCRIBER);
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, GROUP_SUBSCRIBER);
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);

            // when
            var direct = store.listByAddress(DIRECT_SUBSCRIBER);
            var group = store.listByAddress(GROUP_SUBSCRIBER);

            // then
            assertThat(direct).extracting(MonitoredItem::appId).containsExactly(OTHER_APP_ID, SOME_APP_ID);
            assertThat(group).extracting(MonitoredItem::appId).containsExactly(SOME_APP_ID);
            assertThat(store.listByAddress(OTHER_DIRECT_SUBSCRIBER)).isEmpty();
        }

        @Test
        void shouldDropHandEditedItemsWithoutSubscribers() {
            // given
            repository.seed(
                    monitoredItemBuilder().subscribers(List.of()).build(),
                    monitoredItemBuilder().appId(OTHER_APP_ID).name(OTHER_NAME).build());

            // when
            var items = store.listAll();

            // then
            assertThat(items).extracting(MonitoredItem::appId).containsExactly(OTHER_APP_ID);
            assertThat(repository.stored()).containsOnlyKeys(OTHER_APP_ID);
            assertThat(store.monitoredCount()).isEqualTo(1);
        }

        @Test
        void shouldReturnImmutableSnapshots() {
            // given
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);

            // when
            var items = store.listAll();

            // then
            assertThatThrownBy(() -> items.add(monitoredItemBuilder().build()))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class ExclusiveAccess {

        @Test
        void shouldNotPersistWhenOperationFails() {
            // given
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);
            var saves = repository.saveCount();

            // when
            assertThatThrownBy(() -> store.withExclusiveAccess(document -> {
                document.remove(SOME_APP_ID);
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            // then
            assertThat(repository.saveCount()).isEqualTo(saves);
            assertThat(store.find(SOME_APP_ID)).isPresent();
        }

        @Test
        void shouldNotPersistReadOnlyAccess() {
            // given
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);
            var saves = repository.saveCount();

            // when
            store.listAll();
            store.find(SOME_APP_ID);
            store.listByAddress(DIRECT_SUBSCRIBER);

            // then
            assertThat(repository.saveCount()).isEqualTo(saves);
        }

        @Test
        void shouldRemoveItemWhenPutWithoutSubscribers() {
            // given
            store.subscribe(SOME_APP_ID, SOME_NAME, SOME_REGION, DIRECT_SUBSCRIBER);

            // when
            store.withExclusiveAccess(document -> {
                document.put(monitoredItemBuilder().subscribers(List.of()).build());
                return null;
            });

            // then
            assertThat(store.listAll()).isEmpty();
        }
    }
}
