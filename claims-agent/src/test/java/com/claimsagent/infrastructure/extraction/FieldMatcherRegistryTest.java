package com.claimsagent.infrastructure.extraction;

import com.claimsagent.domain.claim.model.ClaimField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldMatcherRegistryTest {

    private final FieldMatcherRegistry registry = new FieldMatcherRegistry();

    @Test
    @DisplayName("Every extractable field has at least one matcher")
    void every_field_covered() {
        assertThat(registry.matchers()).containsOnlyKeys(ClaimField.values());
        assertThat(registry.matchers().values()).allSatisfy(matchers -> assertThat(matchers).isNotEmpty());
    }

    @Test
    @DisplayName("The registry cannot be modified from outside")
    void unmodifiable() {
        assertThatThrownBy(() -> registry.matchers().put(ClaimField.ASSET_ID, List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Range matcher is tried before the separate start label")
    void effective_start_order() {
        List<FieldMatcher> matchers = registry.matchersFor(ClaimField.EFFECTIVE_START);

        assertThat(matchers).hasSize(2);
        assertThat(matchers.get(0).match("Effective Dates: 2024-01-01 to 2024-12-31")).isPresent();
        assertThat(matchers.get(1).match("Start Date: 2024-01-01")).isPresent();
    }

    @Test
    @DisplayName("A matcher skips occurrences that do not parse and takes the next one")
    void skips_unparseable_occurrence() {
        FieldMatcher matcher = registry.matchersFor(ClaimField.POLICY_NUMBER).get(0);

        assertThat(matcher.match("Policy Number: pending\nPolicy No: POL-77")).isEqualTo(Optional.of("POL-77"));
    }

    @Test
    @DisplayName("A value on the line below its label is read unless that line is another label")
    void value_on_next_line() {
        FieldMatcher claimant = registry.matchersFor(ClaimField.CLAIMANT).get(0);

        assertThat(claimant.match("Claimant:\nSam Rivers")).isEqualTo(Optional.of("Sam Rivers"));
        assertThat(claimant.match("Claimant:\nContact Phone: 555-123-4567")).isEmpty();
    }

    @Test
    @DisplayName("A name stops in front of a second label on the same line")
    void name_stops_at_inline_label() {
        FieldMatcher holder = registry.matchersFor(ClaimField.POLICYHOLDER_NAME).get(0);

        assertThat(holder.match("Policyholder Name: John Doe Claimant: Jane Roe")).isEqualTo(Optional.of("John Doe"));
        assertThat(holder.match("Insured: Mary Claire Date")).isEqualTo(Optional.of("Mary Claire Date"));
    }
}
