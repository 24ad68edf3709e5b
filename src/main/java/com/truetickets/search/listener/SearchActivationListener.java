package com.truetickets.search.listener;

import com.truetickets.search.event.SearchSurfaceToggledEvent;
import com.truetickets.search.service.EntitySearchResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class SearchActivationListener {

    private final EntitySearchResolver entitySearchResolver;

    @EventListener
    public void handleToggle(SearchSurfaceToggledEvent event) {
        log.debug("Search surface toggled, open={}", event.open());
        if (event.open()) {
            entitySearchResolver.open();
        } else {
            entitySearchResolver.close();
        }
    }
}
