package com.chatrelay.fallback;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Canned replies used when every provider attempt has failed. Categories are
 * checked in declaration order and the first match wins.
 */
public class FallbackResponder {

    public static final String GREETING =
            "Привет! Я AI-ассистент. Чем могу помочь вам сегодня?";
    public static final String IDENTITY =
            "Я AI-ассистент: отвечаю на вопросы, помогаю с идеями и текстами. "
                    + "Для ответов я использую несколько языковых моделей и сам выбираю доступную.";
    public static final String CREATION =
            "Отлично! Опишите подробнее, что вы хотите создать, и я постараюсь помочь.";
    public static final String WELLBEING =
            "У меня всё отлично, спасибо что спросили! Как ваши дела?";
    public static final String IMAGE =
            "Изображение можно создать в генераторе изображений. Просто опишите, что хотите увидеть!";
    public static final String SERVICE =
            "Сервис работает через бесплатные AI-провайдеры и не требует платных API-ключей.";

    static final List<String> POOL = List.of(
            "Я использую несколько AI-провайдеров и автоматически выбираю тот, что доступен прямо сейчас.",
            "Сейчас языковые модели отвечают медленно. Попробуйте переформулировать вопрос или повторить его чуть позже.",
            "Понял! Чем конкретно могу помочь? Готов ответить на вопрос или просто поболтать."
    );

    private static final Pattern CYRILLIC = Pattern.compile("\\p{IsCyrillic}");

    private record Category(List<String> keywords, String reply) {}

    private static final List<Category> CATEGORIES = List.of(
            new Category(List.of("привет", "здравствуй", "hello", "hi"), GREETING),
            new Category(List.of("кто ты", "что ты", "о себе", "что такое", "расскажи о", "бот"), IDENTITY),
            new Category(List.of("создай", "нарисуй", "сгенерируй"), CREATION),
            new Category(List.of("как дела", "как ты", "how are you"), WELLBEING),
            new Category(List.of("изображен", "картин", "image", "picture"), IMAGE),
            new Category(List.of("бесплатн", "api key", "ключ"), SERVICE)
    );

    private final Random random;

    public FallbackResponder() {
        this(new Random());
    }

    public FallbackResponder(Random random) {
        this.random = random;
    }

    /** Reply of the first keyword category the message hits, if any. */
    public Optional<String> match(String message) {
        if (message == null) return Optional.empty();
        var lower = message.toLowerCase(Locale.ROOT);
        return CATEGORIES.stream()
                .filter(c -> c.keywords().stream().anyMatch(lower::contains))
                .map(Category::reply)
                .findFirst();
    }

    public String respond(String message) {
        return match(message).orElseGet(() -> POOL.get(random.nextInt(POOL.size())));
    }

    /** Apology naming the provider, in Russian for Cyrillic input and English otherwise. */
    public String apology(String message, String provider) {
        if (message != null && CYRILLIC.matcher(message).find()) {
            return "Извините, возникла проблема с провайдером " + provider + ". Попробуйте еще раз.";
        }
        return "Sorry, there was a problem with provider " + provider + ". Please try again.";
    }
}
