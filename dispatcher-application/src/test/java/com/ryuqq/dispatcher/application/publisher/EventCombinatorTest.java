package com.ryuqq.dispatcher.application.publisher;

import com.ryuqq.dispatcher.core.event.AtomicDomainEvent;
import com.ryuqq.dispatcher.core.event.CombinedDomainEvent;
import com.ryuqq.dispatcher.core.event.DomainEvent;
import com.ryuqq.dispatcher.core.handler.DomainEventHandler;
import com.ryuqq.dispatcher.core.handler.DomainEventSubscriber;
import com.ryuqq.dispatcher.core.handler.SimpleDomainEventHandler;
import com.ryuqq.dispatcher.core.retry.RetrySettings;
import com.ryuqq.dispatcher.testkit.fixture.AnyErrorRetryEvent;
import com.ryuqq.dispatcher.testkit.fixture.NoRetryEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * EventCombinator 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class EventCombinatorTest {

    private final EventCombinator combinator = new EventCombinator();

    @Test
    void expand_묶음_이벤트를_제자리에서_펼침() {
        // given
        AtomicDomainEvent first = new NoRetryEvent();
        AtomicDomainEvent second = new AnyErrorRetryEvent();
        AtomicDomainEvent third = new NoRetryEvent();
        List<DomainEvent> events = List.of(first, CombinedDomainEvent.of("Pair", List.of(second, third)));

        // when
        List<AtomicDomainEvent> expanded = combinator.expand(events);

        // then
        assertThat(expanded).containsExactly(first, second, third);
    }

    @Test
    void combine_이벤트마다_구독자_등록_순서로_핸들러_수집() {
        // given
        AtomicDomainEvent first = new NoRetryEvent();
        AtomicDomainEvent second = new AnyErrorRetryEvent();
        List<String> asked = new ArrayList<>();
        DomainEventHandler a = mock(SimpleDomainEventHandler.class);
        DomainEventHandler b = mock(SimpleDomainEventHandler.class);
        DomainEventSubscriber subscriberA = event -> {
            asked.add("A:" + (event == first ? 1 : 2));
            return Optional.of(a);
        };
        DomainEventSubscriber subscriberB = event -> {
            asked.add("B:" + (event == first ? 1 : 2));
            return event == first ? Optional.empty() : Optional.of(b);
        };

        // when
        Publication publication = combinator.combine(List.of(first, second), List.of(subscriberA, subscriberB)).orElseThrow();

        // then
        assertThat(asked).containsExactly("A:1", "B:1", "A:2", "B:2");
        assertThat(publication.handlers()).containsExactly(a, a, b);
        assertThat(publication.events()).containsExactly(first, second);
    }

    @Test
    void combine_단일_이벤트도_결합_정책을_사용() {
        // given
        AtomicDomainEvent event = new AnyErrorRetryEvent(new RetrySettings(4, 20, 60));

        // when
        Publication publication = combinator.combine(List.of(event), List.of()).orElseThrow();

        // then
        assertThat(publication.retryPolicy().retryMax()).isEqualTo(4);
        assertThat(publication.retryPolicy().retryIntervalExtendFactorMillis()).isEqualTo(20L);
        assertThat(publication.retryPolicy().retryIntervalMaxMillis()).isEqualTo(60L);
        assertThat(publication.handlers()).isEmpty();
    }

    @Test
    void combine_펼친_이벤트가_없으면_empty() {
        // when
        Optional<Publication> publication = combinator.combine(
            List.of(CombinedDomainEvent.of("Nothing", List.of())), List.of()
        );

        // then
        assertThat(publication).isEmpty();
    }

    @Test
    void combine_구독자가_null을_반환하면_예외() {
        // given
        DomainEventSubscriber broken = event -> null;

        // when & then
        assertThatThrownBy(() -> combinator.combine(List.of(new NoRetryEvent()), List.of(broken)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("returned null");
    }

    @Test
    void expand_null_이벤트는_거부() {
        List<DomainEvent> events = new ArrayList<>();
        events.add(null);

        assertThatThrownBy(() -> combinator.expand(events))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
