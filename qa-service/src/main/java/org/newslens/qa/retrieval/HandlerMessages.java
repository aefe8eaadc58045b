package org.newslens.qa.retrieval;

import org.newslens.qa.config.QaProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Localized user-facing messages for handlers and degraded answers.
 *
 * <p>Available in {@code az}, {@code en} and {@code ru}. Any other language gets
 * the configured fallback language, and {@code en} if that one is missing too.</p>
 */
@Component
public class HandlerMessages {

    private static final String DEFAULT_LANGUAGE = "en";

    private static final Map<MessageKey, Map<String, String>> CATALOGUE = new EnumMap<>(MessageKey.class);

    static {
        CATALOGUE.put(MessageKey.TALK, Map.of(
                "az", """
                        Salam! Mən Azərbaycan xəbərləri üzrə AI köməkçisiyəm.

                        Nə edə bilərəm:
                        • Xəbərləri axtarmaq və təhlil etmək
                        • Hadisələr, şəxslər və təşkilatlar haqqında məlumat vermək
                        • İl, ay və kateqoriya üzrə statistika göstərmək

                        Nümunə: "2025-ci ildə ən önəmli xəbərlər hansılardır?"

                        Sualınızı yazın!""",
                "en", """
                        Hello! I am an AI assistant for Azerbaijani news.

                        What I can do:
                        • Search and analyse news
                        • Tell you about events, people and organizations
                        • Show statistics by year, month and category

                        Example: "What were the most important news in 2025?"

                        Ask me your question!""",
                "ru", """
                        Привет! Я AI-помощник по новостям Азербайджана.

                        Что я умею:
                        • Искать и анализировать новости
                        • Рассказывать о событиях, людях и организациях
                        • Показывать статистику по годам, месяцам и категориям

                        Пример: "Какие самые важные новости 2025 года?"

                        Задайте свой вопрос!"""));

        CATALOGUE.put(MessageKey.ATTACKING, Map.of(
                "az", """
                        Xəbərdarlıq

                        Sorğunuzda potensial təhlükəli məzmun aşkar edildi.
                        Sistem yalnız xəbər axtarışı və təhlili üçündür, həssas məlumatlar əlçatan deyil
                        və şübhəli sorğular qeydə alınır.

                        Zəhmət olmasa, xəbərlərlə bağlı sual verin.""",
                "en", """
                        Warning

                        Potentially dangerous content was detected in your query.
                        This system only searches and analyses news, sensitive information is not accessible
                        and suspicious requests are logged.

                        Please ask a question about the news.""",
                "ru", """
                        Предупреждение

                        В вашем запросе обнаружено потенциально опасное содержимое.
                        Система предназначена только для поиска и анализа новостей, конфиденциальные данные недоступны,
                        а подозрительные запросы регистрируются.

                        Пожалуйста, задайте вопрос о новостях."""));

        CATALOGUE.put(MessageKey.PREDICTION, Map.of(
                "az", """
                        Sistem gələcək haqqında proqnoz vermir.
                        Keçmiş məlumatlar üzrə trendləri soruşa bilərsiniz, məsələn:
                        • "Son 6 ayda hansı mövzular daha çox müzakirə olundu?"
                        • "Ən çox xəbər hansı kateqoriyadadır?\"""",
                "en", """
                        The system does not make predictions about the future.
                        You can ask about trends in historical data instead, for example:
                        • "Which topics were discussed most in the last 6 months?"
                        • "Which category has the most news?\"""",
                "ru", """
                        Система не делает прогнозов на будущее.
                        Вместо этого можно спросить о трендах по историческим данным, например:
                        • "Какие темы обсуждались чаще всего за последние 6 месяцев?"
                        • "В какой категории больше всего новостей?\""""));

        CATALOGUE.put(MessageKey.NO_RESULTS, Map.of(
                "az", "Sorğunuz üzrə məlumat tapılmadı. Başqa sözlərlə və ya daha ümumi terminlərlə yenidən cəhd edin.",
                "en", "No information was found for your query. Try different words or more general terms.",
                "ru", "По вашему запросу ничего не найдено. Попробуйте другие слова или более общие термины."));

        CATALOGUE.put(MessageKey.STATISTICS_ERROR, Map.of(
                "az", "Statistik sorğu icra edilərkən xəta baş verdi. Sualı sadələşdirib yenidən cəhd edin.",
                "en", "An error occurred while running the statistics query. Please simplify the question and try again.",
                "ru", "При выполнении статистического запроса произошла ошибка. Упростите вопрос и попробуйте снова."));

        CATALOGUE.put(MessageKey.SEARCH_ERROR, Map.of(
                "az", "Xəbər axtarışı hazırda mümkün olmadı. Bir az sonra yenidən cəhd edin.",
                "en", "News search is not available right now. Please try again later.",
                "ru", "Поиск новостей сейчас недоступен. Попробуйте позже."));

        CATALOGUE.put(MessageKey.GENERATION_ERROR, Map.of(
                "az", "Cavab hazırlanarkən xəta baş verdi. Bir az sonra yenidən cəhd edin.",
                "en", "An error occurred while preparing the answer. Please try again later.",
                "ru", "При подготовке ответа произошла ошибка. Попробуйте позже."));

        CATALOGUE.put(MessageKey.NO_INFORMATION, Map.of(
                "az", "Təəssüf ki, bu mövzuda heç bir xəbər tapa bilmədim.",
                "en", "Unfortunately, I could not find any news on this topic.",
                "ru", "К сожалению, я не нашёл новостей на эту тему."));

        CATALOGUE.put(MessageKey.UNSAFE_QUERY, Map.of(
                "az", "Bu sual üçün təhlükəsiz sorğu qurmaq mümkün olmadı. Sualı başqa cür ifadə edin.",
                "en", "A safe query could not be built for this question. Please rephrase it.",
                "ru", "Для этого вопроса не удалось построить безопасный запрос. Переформулируйте его."));

        CATALOGUE.put(MessageKey.PIPELINE_ERROR, Map.of(
                "az", "Sualınız emal edilə bilmədi.",
                "en", "Your question could not be processed.",
                "ru", "Ваш вопрос не удалось обработать."));
    }

    private final String fallbackLanguage;

    public HandlerMessages(QaProperties properties) {
        String configured = properties.getFallbackLanguage();
        this.fallbackLanguage = configured != null ? configured.trim().toLowerCase(Locale.ROOT) : DEFAULT_LANGUAGE;
    }

    public String get(MessageKey key, String language) {
        Map<String, String> translations = CATALOGUE.get(key);
        String lang = language != null ? language.trim().toLowerCase(Locale.ROOT) : "";
        String message = translations.get(lang);
        if (message == null) {
            message = translations.get(fallbackLanguage);
        }
        return message != null ? message : translations.get(DEFAULT_LANGUAGE);
    }

    /**
     * Returns the language {@link #get} actually renders for {@code language}.
     */
    public String resolveLanguage(String language) {
        String lang = language != null ? language.trim().toLowerCase(Locale.ROOT) : "";
        if (CATALOGUE.get(MessageKey.TALK).containsKey(lang)) {
            return lang;
        }
        return CATALOGUE.get(MessageKey.TALK).containsKey(fallbackLanguage) ? fallbackLanguage : DEFAULT_LANGUAGE;
    }
}
