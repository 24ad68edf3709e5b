package com.truetickets.search.config;

import com.truetickets.search.event.NavigationRequestedEvent;
import com.truetickets.search.event.SearchSurfaceClosedEvent;
import com.truetickets.search.infra.SearchScheduler;
import com.truetickets.search.repository.TicketRepository;
import com.truetickets.search.service.CloseSignal;
import com.truetickets.search.service.EntitySearchResolver;
import com.truetickets.search.service.LookupDispatcher;
import com.truetickets.search.service.NavigationCallback;
import com.truetickets.search.service.QueryClassifier;
import com.truetickets.search.service.ResultCoalescer;
import com.truetickets.search.service.SuffixResolver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the search surface. Hosts that do not provide their own callbacks receive navigation and
 * close requests as application events.
 */
@Configuration
public class SearchSurfaceConfig {

    @Bean
    @ConditionalOnMissingBean
    public NavigationCallback navigationCallback(ApplicationEventPublisher eventPublisher) {
        return path -> eventPublisher.publishEvent(new NavigationRequestedEvent(path));
    }

    @Bean
    @ConditionalOnMissingBean
    public CloseSignal closeSignal(ApplicationEventPublisher eventPublisher) {
        return () -> eventPublisher.publishEvent(new SearchSurfaceClosedEvent());
    }

    @Bean(destroyMethod = "close")
    public EntitySearchResolver entitySearchResolver(
        QueryClassifier classifier,
        SuffixResolver suffixResolver,
        LookupDispatcher dispatcher,
        ResultCoalescer coalescer,
        TicketRepository ticketRepository,
        @Qualifier("lookupTaskExecutor") Executor lookupTaskExecutor,
        SearchScheduler searchScheduler,
        SearchProperties properties,
        NavigationCallback navigationCallback,
        CloseSignal closeSignal
    ) {
        return new EntitySearchResolver(
            classifier,
            suffixResolver,
            dispatcher,
            coalescer,
            ticketRepository,
            lookupTaskExecutor,
            searchScheduler,
            properties.debounce(),
            navigationCallback,
            closeSignal
        );
    }
}
