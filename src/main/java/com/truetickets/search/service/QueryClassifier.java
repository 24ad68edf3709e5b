package com.truetickets.search.service;

import com.truetickets.search.model.Query;
import com.truetickets.search.model.SearchStrategy;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the lookup strategy for a query. Rules are checked in order and the first match wins:
 * <ol>
 *   <li>blank input: no lookup at all</li>
 *   <li>7 to 11 digits and no letters: customer lookup by phone</li>
 *   <li>exactly three digits: ticket number suffix</li>
 *   <li>up to six digits: exact ticket number</li>
 *   <li>anything else: text search over customers and tickets</li>
 * </ol>
 */
@Component
public class QueryClassifier {

    static final int MIN_PHONE_DIGITS = 7;
    static final int MAX_PHONE_DIGITS = 11;
    static final int SUFFIX_LENGTH = 3;
    static final int MAX_TICKET_NUMBER_LENGTH = 6;

    public SearchStrategy classify(Query query) {
        if (query.isEmpty()) {
            return new SearchStrategy.NoQuery();
        }

        if (isLikelyPhone(query.digits()) && !query.containsLetter()) {
            return new SearchStrategy.PhoneLookup(query.digits());
        }

        String text = query.trimmed();
        if (query.isNumeric() && text.length() == SUFFIX_LENGTH) {
            return new SearchStrategy.SuffixTicketLookup(text, List.of());
        }
        if (query.isNumeric() && text.length() <= MAX_TICKET_NUMBER_LENGTH) {
            return new SearchStrategy.ExactTicketLookup(text);
        }
        return new SearchStrategy.DualTextLookup(text);
    }

    public static boolean isLikelyPhone(String digits) {
        return digits.length() >= MIN_PHONE_DIGITS && digits.length() <= MAX_PHONE_DIGITS;
    }
}
