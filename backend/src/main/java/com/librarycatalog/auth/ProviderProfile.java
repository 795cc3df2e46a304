package com.librarycatalog.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Profile returned by the identity provider after the code exchange.
 *
 * @param id          provider-side subject id
 * @param emails      addresses in provider order
 * @param name        given and family name
 * @param displayName full name as shown by the provider
 * @param photos      picture URLs, possibly empty
 */
public record ProviderProfile(
        String id,
        List<Email> emails,
        Name name,
        String displayName,
        List<Photo> photos
) {

    public ProviderProfile {
        emails = emails == null ? List.of() : List.copyOf(emails);
        photos = photos == null ? List.of() : List.copyOf(photos);
        name = name == null ? new Name(null, null) : name;
    }

    /**
     * First verified address, falling back to the first listed one.
     */
    public String primaryEmail() {
        return emails.stream()
                .filter(Email::verified)
                .map(Email::value)
                .findFirst()
                .orElseGet(() -> emails.isEmpty() ? null : emails.get(0).value());
    }

    public String firstPhoto() {
        return photos.isEmpty() ? null : photos.get(0).value();
    }

    /**
     * Maps the attributes of Google's OAuth2 user-info endpoint
     * ({@code sub, email, email_verified, given_name, family_name, name, picture}).
     */
    public static ProviderProfile fromGoogleAttributes(Map<String, Object> attributes) {
        List<Email> emails = new ArrayList<>();
        String email = asString(attributes.get("email"));
        if (email != null && !email.isBlank()) {
            Object verified = attributes.get("email_verified");
            emails.add(new Email(email, verified == null || Boolean.parseBoolean(verified.toString())));
        }

        List<Photo> photos = new ArrayList<>();
        String picture = asString(attributes.get("picture"));
        if (picture != null && !picture.isBlank()) {
            photos.add(new Photo(picture));
        }

        return new ProviderProfile(
                asString(attributes.get("sub")),
                emails,
                new Name(asString(attributes.get("given_name")), asString(attributes.get("family_name"))),
                asString(attributes.get("name")),
                photos);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    public record Email(String value, boolean verified) {

        public Email(String value) {
            this(value, true);
        }
    }

    public record Name(String givenName, String familyName) {
    }

    public record Photo(String value) {
    }
}
