package dev.pekelund.ezexpense.reconciliation;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Evaluates field rules and the attachment-consistency rule against a snapshot. Never mutates state.
 *
 * <p>Field rules apply only to editable fields; other fields are reported neutral. The attachment
 * flag is checked for every expense: a declared "Yes" is valid only while the expense holds no
 * attachments and a declared "No" only while it holds at least one, since the flag describes the
 * receipts already filed in the external expense system.
 */
public class ExpenseValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExpenseValidator.class);

    private static final Pattern DATE_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern NUMBER_PATTERN =
        Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final CategoryCatalog categoryCatalog;
    private final AtomicReference<Set<String>> categories = new AtomicReference<>();

    public ExpenseValidator(CategoryCatalog categoryCatalog) {
        this.categoryCatalog = categoryCatalog;
    }

    /**
     * @param editableFields names of the fields the caller lets the user edit, or {@code null} when
     *     every field is editable
     */
    public ValidationReport validate(ReconciliationSnapshot snapshot, Set<String> editableFields) {
        List<FieldValidation> results = new ArrayList<>();
        for (ExpenseSnapshot expense : snapshot.expenses()) {
            for (Map.Entry<String, String> field : expense.fields().entrySet()) {
                results.add(validateField(expense, field.getKey(), field.getValue(), editableFields));
            }
        }
        ValidationReport report = ValidationReport.of(results);
        LOGGER.debug("Validated {} expenses, {} invalid fields", snapshot.expenses().size(),
            report.summary().totalInvalid());
        return report;
    }

    private FieldValidation validateField(ExpenseSnapshot expense, String name, String value,
        Set<String> editableFields) {
        FieldRole role = FieldRole.of(name);
        long id = expense.id();
        if (role == FieldRole.ATTACHMENT_FLAG) {
            return validateAttachmentFlag(expense, name, value);
        }
        if (role == FieldRole.UNRECOGNIZED) {
            return FieldValidation.neutral(id, name, role, null);
        }
        if (editableFields != null && !editableFields.contains(name)) {
            return FieldValidation.neutral(id, name, role, "Not editable");
        }
        return switch (role) {
            case DATE -> isCalendarDate(value)
                ? FieldValidation.valid(id, name, role)
                : FieldValidation.invalid(id, name, role, "Expected a date in YYYY-MM-DD format");
            case AMOUNT -> isFiniteNumber(value)
                ? FieldValidation.valid(id, name, role)
                : FieldValidation.invalid(id, name, role, "Expected a number");
            case REQUIRED_TEXT -> StringUtils.hasText(value)
                ? FieldValidation.valid(id, name, role)
                : FieldValidation.invalid(id, name, role, "Required");
            case CATEGORY -> validateCategory(id, name, value);
            default -> FieldValidation.neutral(id, name, role, null);
        };
    }

    private FieldValidation validateCategory(long id, String name, String value) {
        if (!StringUtils.hasText(value)) {
            return FieldValidation.invalid(id, name, FieldRole.CATEGORY, "Required");
        }
        Set<String> allowed = allowedCategories();
        if (allowed == null) {
            return FieldValidation.neutral(id, name, FieldRole.CATEGORY, "Category list unavailable");
        }
        return allowed.contains(normalize(value))
            ? FieldValidation.valid(id, name, FieldRole.CATEGORY)
            : FieldValidation.invalid(id, name, FieldRole.CATEGORY, "Unknown category");
    }

    private FieldValidation validateAttachmentFlag(ExpenseSnapshot expense, String name, String value) {
        long id = expense.id();
        if (!StringUtils.hasText(value)) {
            return FieldValidation.neutral(id, name, FieldRole.ATTACHMENT_FLAG, null);
        }
        String declared = value.trim().toLowerCase(Locale.ROOT);
        int attachments = expense.attachmentCount();
        if (declared.equals("yes")) {
            return attachments == 0
                ? FieldValidation.valid(id, name, FieldRole.ATTACHMENT_FLAG)
                : FieldValidation.invalid(id, name, FieldRole.ATTACHMENT_FLAG,
                    "Declared Yes but %d receipts are attached".formatted(attachments));
        }
        if (declared.equals("no")) {
            return attachments > 0
                ? FieldValidation.valid(id, name, FieldRole.ATTACHMENT_FLAG)
                : FieldValidation.invalid(id, name, FieldRole.ATTACHMENT_FLAG,
                    "Declared No but no receipts are attached");
        }
        return FieldValidation.invalid(id, name, FieldRole.ATTACHMENT_FLAG, "Expected Yes or No");
    }

    private Set<String> allowedCategories() {
        Set<String> cached = categories.get();
        if (cached != null) {
            return cached;
        }
        List<String> fetched;
        try {
            fetched = categoryCatalog.categories();
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to load expense categories; category fields are reported neutral", ex);
            return null;
        }
        Set<String> normalized = fetched == null ? Set.of() : fetched.stream()
            .filter(StringUtils::hasText)
            .map(ExpenseValidator::normalize)
            .collect(Collectors.toUnmodifiableSet());
        categories.compareAndSet(null, normalized);
        return categories.get();
    }

    static boolean isCalendarDate(String value) {
        if (value == null || !DATE_PATTERN.matcher(value).matches()) {
            return false;
        }
        try {
            LocalDate.parse(value, DATE_FORMAT);
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    static boolean isFiniteNumber(String value) {
        if (!StringUtils.hasText(value)) {
            return false;
        }
        String trimmed = value.trim();
        if (!NUMBER_PATTERN.matcher(trimmed).matches()) {
            return false;
        }
        return Double.isFinite(Double.parseDouble(trimmed));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
