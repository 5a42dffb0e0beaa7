package dev.pekelund.ezexpense.web;

/**
 * Error body returned by the JSON API.
 */
public record ApiError(String error, String message) {
}
