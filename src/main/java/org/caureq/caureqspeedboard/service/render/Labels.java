package org.caureq.caureqspeedboard.service.render;

import org.caureq.caureqspeedboard.domain.ClusterStatus;
import org.caureq.caureqspeedboard.domain.Language;
import org.caureq.caureqspeedboard.domain.NodeHealth;
import org.caureq.caureqspeedboard.domain.Tier;
import org.caureq.caureqspeedboard.domain.ViewMode;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Phrase tables per language. Only labels live here; layout and numbers are language-neutral.
 * Missing keys fall back to English, then to the key itself.
 */
public final class Labels {

    private static final Map<Language, Map<String, String>> TABLES = new EnumMap<>(Language.class);

    static {
        TABLES.put(Language.EN, Map.ofEntries(
                Map.entry("title", "📊 Internet Speed Report"),
                Map.entry("status", "Status"),
                Map.entry("summary", "Summary"),
                Map.entry("download", "Download"),
                Map.entry("upload", "Upload"),
                Map.entry("ping", "Ping"),
                Map.entry("isp", "ISP"),
                Map.entry("location", "Location"),
                Map.entry("test_server", "Test server"),
                Map.entry("os", "OS"),
                Map.entry("no_data", "No data"),
                Map.entry("never_reported", "never reported"),
                Map.entry("stale_since", "stale, last seen %d min ago"),
                Map.entry("last_seen", "last seen %d min ago"),
                Map.entry("no_nodes", "No nodes configured or reporting yet."),
                Map.entry("tier_very_low", "Very low"),
                Map.entry("tier_low", "Low"),
                Map.entry("tier_medium", "Normal"),
                Map.entry("tier_good", "Good"),
                Map.entry("tier_excellent", "Excellent"),
                Map.entry("health_ok", "OK"),
                Map.entry("health_degraded", "Degraded"),
                Map.entry("health_stale", "Offline"),
                Map.entry("cluster_ok", "All nodes OK"),
                Map.entry("cluster_degraded", "Degraded"),
                Map.entry("view_compact", "📄 Compact"),
                Map.entry("view_detailed", "📋 Detailed"),
                Map.entry("settings_prompt", "⚙️ Choose the language and view for this chat."),
                Map.entry("pref_saved", "Saved"),
                Map.entry("pref_failed", "Could not save the setting, please try again"),
                Map.entry("pref_unknown", "Unknown option")
        ));
        TABLES.put(Language.RU, Map.ofEntries(
                Map.entry("title", "📊 Отчет о скорости интернета"),
                Map.entry("status", "Статус"),
                Map.entry("summary", "Итоги"),
                Map.entry("download", "Загрузка"),
                Map.entry("upload", "Отдача"),
                Map.entry("ping", "Пинг"),
                Map.entry("isp", "Провайдер"),
                Map.entry("location", "Локация"),
                Map.entry("test_server", "Тестовый сервер"),
                Map.entry("os", "ОС"),
                Map.entry("no_data", "Нет данных"),
                Map.entry("never_reported", "отчётов не было"),
                Map.entry("stale_since", "устарело, последний отчёт %d мин назад"),
                Map.entry("last_seen", "обновлено %d мин назад"),
                Map.entry("no_nodes", "Узлы ещё не настроены и не присылали отчётов."),
                Map.entry("tier_very_low", "Очень низко"),
                Map.entry("tier_low", "Низко"),
                Map.entry("tier_medium", "Нормально"),
                Map.entry("tier_good", "Хорошо"),
                Map.entry("tier_excellent", "Отлично"),
                Map.entry("health_ok", "В норме"),
                Map.entry("health_degraded", "Просадка"),
                Map.entry("health_stale", "Офлайн"),
                Map.entry("cluster_ok", "Все узлы в норме"),
                Map.entry("cluster_degraded", "Есть проблемы"),
                Map.entry("view_compact", "📄 Кратко"),
                Map.entry("view_detailed", "📋 Подробно"),
                Map.entry("settings_prompt", "⚙️ Выберите язык и вид отчёта для этого чата."),
                Map.entry("pref_saved", "Сохранено"),
                Map.entry("pref_failed", "Не удалось сохранить настройку, попробуйте ещё раз"),
                Map.entry("pref_unknown", "Неизвестный вариант")
        ));
    }

    private Labels() {}

    public static String get(String key, Language language) {
        var table = TABLES.get(language == null ? Language.FALLBACK : language);
        var value = table.get(key);
        if (value == null) value = TABLES.get(Language.FALLBACK).get(key);
        return value == null ? key : value;
    }

    public static String format(String key, Language language, Object... args) {
        return String.format(Locale.ROOT, get(key, language), args);
    }

    public static String tier(Tier tier, Language language) {
        return get("tier_" + tier.name().toLowerCase(Locale.ROOT), language);
    }

    public static String health(NodeHealth health, Language language) {
        return get("health_" + health.name().toLowerCase(Locale.ROOT), language);
    }

    public static String cluster(ClusterStatus status, Language language) {
        return get("cluster_" + status.name().toLowerCase(Locale.ROOT), language);
    }

    public static String view(ViewMode mode, Language language) {
        return get("view_" + mode.code(), language);
    }
}
