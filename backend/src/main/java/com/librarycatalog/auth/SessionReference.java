package com.librarycatalog.auth;

import java.io.Serializable;

/**
 * What the HTTP session remembers about a login: the user id in string form
 * and nothing else.
 */
public record SessionReference(String userId) implements Serializable {
}
