package dev.metricfortune.service.recommendation;

import dev.metricfortune.entity.PatternMetadata;
import dev.metricfortune.entity.PatternType;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

import static dev.metricfortune.entity.PatternType.ABANDONMENT;
import static dev.metricfortune.entity.PatternType.HESITATION;
import static dev.metricfortune.entity.PatternType.LOW_ENGAGEMENT;

/**
 * Rule book mapping patterns to recommendations. Context rules are tried in list order and the
 * first match wins; every pattern type has a fallback, so each pattern yields a recommendation.
 */
public final class RecommendationRules {

    private static final List<RecommendationRule> CONTEXT_RULES = List.of(
            // abandonment
            new RecommendationRule(ABANDONMENT, subjectContains("shipping"),
                    "Show shipping costs earlier in checkout",
                    "{{dropOffRate}}% of customers abandon during shipping step",
                    List.of("Display estimated shipping cost on product page",
                            "Add shipping calculator before checkout",
                            "Show free shipping threshold in cart"),
                    "Reduce shipping page abandonment by 15-25%",
                    ConversionWeight.HIGH),
            new RecommendationRule(ABANDONMENT, subjectContains("payment"),
                    "Simplify payment process",
                    "{{dropOffRate}}% of customers abandon during payment step",
                    List.of("Add more trusted payment badges near form",
                            "Reduce required payment form fields",
                            "Enable express checkout options (Apple Pay, Google Pay)"),
                    "Reduce payment abandonment by 10-20%",
                    ConversionWeight.HIGH),
            new RecommendationRule(ABANDONMENT, subjectContains("product"),
                    "Improve product page content",
                    "{{dropOffRate}}% of visitors leave product pages without adding to cart",
                    List.of("Add more product images (minimum 5 angles)",
                            "Enhance product descriptions with key benefits",
                            "Add customer reviews and ratings prominently"),
                    "Increase add-to-cart rate by 8-15%",
                    ConversionWeight.HIGH),
            new RecommendationRule(ABANDONMENT, subjectContains("cart"),
                    "Optimize shopping cart experience",
                    "{{dropOffRate}}% of customers abandon their cart",
                    List.of("Add urgency indicators (low stock, time-limited offers)",
                            "Display clear savings summary",
                            "Show free shipping threshold progress"),
                    "Reduce cart abandonment by 10-18%",
                    ConversionWeight.HIGH),

            // hesitation
            new RecommendationRule(HESITATION, subjectContains("address"),
                    "Add address autocomplete functionality",
                    "{{reEntryRate}}% of users re-enter address information {{avgReEntries}} times",
                    List.of("Implement Google Places address autocomplete",
                            "Add clear format examples (e.g., '123 Main St')",
                            "Show real-time validation feedback"),
                    "Reduce form completion time by 30-40%",
                    ConversionWeight.MEDIUM),
            new RecommendationRule(HESITATION, subjectContains("card", "credit"),
                    "Improve payment field clarity",
                    "{{reEntryRate}}% of users struggle with payment field entry",
                    List.of("Add input format hints (e.g., 'XXXX XXXX XXXX XXXX')",
                            "Make security badge more visible near card field",
                            "Enable card type auto-detection with icons"),
                    "Reduce payment form errors by 20-30%",
                    ConversionWeight.MEDIUM),
            new RecommendationRule(HESITATION, subjectContains("email"),
                    "Optimize email input experience",
                    "{{reEntryRate}}% of users re-enter email address",
                    List.of("Add inline validation with clear error messages",
                            "Clarify why email is needed (e.g., 'For order confirmation')",
                            "Enable email autofill hints"),
                    "Reduce email field errors by 15-25%",
                    ConversionWeight.MEDIUM),
            new RecommendationRule(HESITATION, subjectContains("phone"),
                    "Simplify phone number entry",
                    "{{reEntryRate}}% of users re-enter phone number",
                    List.of("Add phone format auto-formatting",
                            "Show clear format example (e.g., '(555) 123-4567')",
                            "Make phone field optional if not critical"),
                    "Reduce form abandonment by 8-12%",
                    ConversionWeight.MEDIUM),

            // low engagement
            new RecommendationRule(LOW_ENGAGEMENT, subjectContains("/product"),
                    "Enhance product page engagement",
                    "Product page engagement {{engagementGap}}% below site average ({{timeOnPage}}s vs {{siteAverage}}s)",
                    List.of("Add customer reviews and Q&A section",
                            "Include video demos or 360° product views",
                            "Add size guides and detailed specifications"),
                    "Increase time-on-page by 20-30%",
                    ConversionWeight.LOW_MEDIUM),
            new RecommendationRule(LOW_ENGAGEMENT, subjectContains("/category", "/collection"),
                    "Improve category browsing experience",
                    "Category page engagement {{engagementGap}}% below site average",
                    List.of("Enhance filtering and sorting options",
                            "Add product comparison feature",
                            "Display better product preview images"),
                    "Increase product discovery by 15-20%",
                    ConversionWeight.LOW_MEDIUM),
            new RecommendationRule(LOW_ENGAGEMENT, subjectContains("/cart"),
                    "Make cart more engaging",
                    "Cart page time-on-page {{engagementGap}}% below expected",
                    List.of("Add related products or frequently bought together",
                            "Show clear savings and discount summaries",
                            "Add urgency indicators (limited stock, trending items)"),
                    "Increase cart engagement by 10-15%",
                    ConversionWeight.MEDIUM)
    );

    private static final Map<PatternType, RecommendationRule> FALLBACKS = new EnumMap<>(PatternType.class);

    static {
        FALLBACKS.put(ABANDONMENT, new RecommendationRule(ABANDONMENT, any(),
                "Reduce checkout abandonment",
                "{{dropOffRate}}% of customers abandon during checkout",
                List.of("Simplify checkout process and reduce steps",
                        "Add trust signals and security badges",
                        "Offer guest checkout option"),
                "Reduce abandonment by 10-15%",
                ConversionWeight.HIGH));
        FALLBACKS.put(HESITATION, new RecommendationRule(HESITATION, any(),
                "Improve form field usability",
                "{{reEntryRate}}% of users struggle with form field entry",
                List.of("Add clear field labels and format examples",
                        "Implement inline validation with helpful messages",
                        "Enable autofill and autocomplete where possible"),
                "Reduce form errors by 15-20%",
                ConversionWeight.MEDIUM));
        FALLBACKS.put(LOW_ENGAGEMENT, new RecommendationRule(LOW_ENGAGEMENT, any(),
                "Increase page engagement",
                "Page engagement {{engagementGap}}% below site average",
                List.of("Improve content quality and visual appeal",
                        "Add interactive elements (reviews, videos, comparisons)",
                        "Optimize page loading speed"),
                "Increase engagement by 10-20%",
                ConversionWeight.LOW_MEDIUM));
    }

    private RecommendationRules() {
    }

    /**
     * First matching context rule for the pattern, else its type's fallback.
     */
    public static RecommendationRule ruleFor(PatternMetadata metadata) {
        return CONTEXT_RULES.stream()
                .filter(rule -> rule.matches(metadata))
                .findFirst()
                .orElseGet(() -> FALLBACKS.get(metadata.type()));
    }

    static List<RecommendationRule> contextRules() {
        return CONTEXT_RULES;
    }

    private static Predicate<PatternMetadata> subjectContains(String... fragments) {
        return metadata -> {
            String subject = metadata.subject();
            if (subject == null) {
                return false;
            }
            String lower = subject.toLowerCase(Locale.ROOT);
            return Arrays.stream(fragments).anyMatch(lower::contains);
        };
    }

    private static Predicate<PatternMetadata> any() {
        return metadata -> true;
    }
}
