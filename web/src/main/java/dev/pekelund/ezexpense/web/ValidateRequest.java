package dev.pekelund.ezexpense.web;

import java.util.List;

/**
 * @param editableFields fields the user may edit; {@code null} treats every field as editable
 */
public record ValidateRequest(List<String> editableFields) {
}
