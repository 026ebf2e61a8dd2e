package de.mirkosertic.contactbench.model;

/**
 * A postal address, shared by any number of app users.
 */
public record Address(
        long id,
        String street,
        String streetNumber,
        String cityCode,
        String city,
        String country
) {

    @Override
    public String toString() {
        return street + " " + streetNumber + ", " + city + ", " + country;
    }
}
