package com.truetickets.search.controller;

import com.truetickets.search.exception.LookupFailedException;
import com.truetickets.search.exception.WrongQueryException;
import com.truetickets.search.model.CoalescedResult;
import com.truetickets.search.model.CustomerMatch;
import com.truetickets.search.model.ResultKind;
import com.truetickets.search.model.SearchStatus;
import com.truetickets.search.model.TicketMatch;
import com.truetickets.search.service.SearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SearchService searchService;

    @Test
    @DisplayName("Should return customer matches with navigation paths")
    void search_ShouldReturnCustomers() throws Exception {
        var jane = new CustomerMatch("c-1", "Jane Doe", "5551234567", Instant.ofEpochMilli(1700000000000L));
        when(searchService.resolve("jane")).thenReturn(UnifiedSearchResponse.from(
            new CoalescedResult(ResultKind.CUSTOMER, List.of(jane), SearchStatus.POPULATED)));

        mockMvc.perform(get("/search").param("q", "jane"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.kind").value("CUSTOMER"))
            .andExpect(jsonPath("$.status").value("POPULATED"))
            .andExpect(jsonPath("$.results[0].path").value("/$c-1"))
            .andExpect(jsonPath("$.results[0].name").value("Jane Doe"))
            .andExpect(jsonPath("$.results[0].phone").value("555-123-4567"))
            .andExpect(jsonPath("$.results[0].ticket_number").doesNotExist());
    }

    @Test
    @DisplayName("Should return ticket matches with display status")
    void search_ShouldReturnTickets() throws Exception {
        var ticket = new TicketMatch(36035, "Cracked screen", "Call Customer", "iPhone 12", "Jane Doe", Instant.EPOCH);
        when(searchService.resolve("035")).thenReturn(UnifiedSearchResponse.from(
            new CoalescedResult(ResultKind.TICKET, List.of(ticket), SearchStatus.POPULATED)));

        mockMvc.perform(get("/search").param("q", "035"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results[0].ticket_number").value(36035))
            .andExpect(jsonPath("$.results[0].path").value("/&36035"))
            .andExpect(jsonPath("$.results[0].status").value("Approval Needed"))
            .andExpect(jsonPath("$.results[0].customer_name").value("Jane Doe"));
    }

    @Test
    @DisplayName("Should report an empty result with its message")
    void search_ShouldReturnNoResults() throws Exception {
        when(searchService.resolve(anyString())).thenReturn(UnifiedSearchResponse.from(
            new CoalescedResult(ResultKind.TICKET, List.of(), SearchStatus.NO_RESULTS)));

        mockMvc.perform(get("/search").param("q", "nothing"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results").isEmpty())
            .andExpect(jsonPath("$.message").value("No results found"));
    }

    @Test
    @DisplayName("Should return 400 Bad Request when query 'q' is missing")
    void search_ShouldReturn400_WhenQueryIsMissing() throws Exception {
        mockMvc.perform(get("/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Parameter 'q' is missing"));
    }

    @Test
    @DisplayName("Should return 400 Bad Request for a rejected query")
    void search_ShouldReturn400_WhenQueryIsRejected() throws Exception {
        when(searchService.resolve(anyString())).thenThrow(new WrongQueryException("Query too long"));

        mockMvc.perform(get("/search").param("q", "x"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Query too long"));
    }

    @Test
    @DisplayName("Should return 502 when the backend lookup fails")
    void search_ShouldReturn502_WhenBackendFails() throws Exception {
        when(searchService.resolve(anyString())).thenThrow(new LookupFailedException("/tickets", new RuntimeException("boom")));

        mockMvc.perform(get("/search").param("q", "x"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.status").value(502));
    }
}
