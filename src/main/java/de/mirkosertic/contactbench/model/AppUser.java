package de.mirkosertic.contactbench.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * A contact. Gender is one of {@code M}, {@code F}, {@code O} or absent.
 */
public record AppUser(
        long id,
        String firstName,
        String lastName,
        @Nullable String gender,
        String customerId,
        @Nullable String phoneNumber,
        Instant created,
        @Nullable LocalDate birthday,
        Instant lastUpdated,
        @Nullable Address address
) {

    /**
     * Generates a customer identifier of the form {@code CUST-} followed by twelve upper-case hex digits.
     */
    public static String generateCustomerId() {
        return "CUST-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return firstName + " " + lastName + " (" + customerId + ")";
    }
}
