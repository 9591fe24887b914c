package com.community.moderation.scoring;

import com.community.moderation.model.ContentType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 默认的本地启发式打分器：关键词、格式和语言特征。
 * 各项得分累加后截断到 [0, 1]。
 */
@Component
public class HeuristicSignalScorer implements SignalScorer {

    // --- 1. 推广 / 垃圾信息特征 ---
    private static final List<String> PROMOTIONAL_KEYWORDS = List.of(
            "discount", "offer", "limited", "special", "deal", "sale", "buy now", "click here",
            "visit now", "free gift", "earn money", "act now", "call now", "apply now", "promotion",
            "advertisement", "guaranteed", "winner", "paisa kamao", "free mein", "jaldi karo", "kamao");
    private static final double PROMO_HIT = 0.25;
    private static final double PROMO_CAP = 0.75;

    private static final Pattern LINK = Pattern.compile("(https?://\\S+|www\\.\\S+|\\b\\S+\\.(com|net|org|in)\\b)");
    private static final Pattern PHONE = Pattern.compile("\\b\\d{10}\\b");
    private static final Pattern EMAIL = Pattern.compile("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}");
    private static final Pattern REPEATED_CHARS = Pattern.compile("(.)\\1{4,}");
    private static final Pattern MESSENGER = Pattern.compile("\\b(whatsapp|telegram)\\b");

    // --- 2. 不当内容特征 ---
    private static final List<String> ABUSIVE_TERMS = List.of(
            "abuse", "cruelty", "torture", "starve", "mistreat", "violent", "kill");
    private static final Pattern PROFANITY = Pattern.compile("\\b(damn|hell|stupid|idiot|moron|loser|dumb)\\b");
    private static final List<Pattern> AGGRESSIVE = List.of(
            Pattern.compile("you'?re wrong"),
            Pattern.compile("shut up"),
            Pattern.compile("don'?t listen to"),
            Pattern.compile("terrible advice"));

    // --- 3. 文化语境特征 ---
    private static final Pattern DEVANAGARI = Pattern.compile("[\\u0900-\\u097F]");
    private static final List<String> HINGLISH_MARKERS = List.of(
            "hai", "nahi", "kya", "bhai", "yaar", "accha", "karo", "kar", "mera", "tera", "bahut", "aur", "ke liye");
    private static final List<String> REGIONAL_IDIOMS = List.of(
            "arre yaar", "chalta hai", "jugaad", "bas kar", "pakka", "ek number", "bindaas");

    @Override
    public SignalScores score(String content, ContentType contentType) {
        String raw = content == null ? "" : content;
        String text = raw.toLowerCase(Locale.ROOT);
        Set<String> flags = new LinkedHashSet<>();

        double spam = scoreSpam(raw, text, flags);
        double toxicity = scoreToxicity(text, flags);
        double cultural = scoreCulturalContext(raw, text, flags);
        double quality = scoreQuality(raw, spam, toxicity, contentType);
        if (quality < 0.3) {
            flags.add("low_quality");
        }
        return new SignalScores(spam, toxicity, quality, cultural, flags).clamped();
    }

    private double scoreSpam(String raw, String text, Set<String> flags) {
        double score = 0.0;

        int promoHits = 0;
        for (String keyword : PROMOTIONAL_KEYWORDS) {
            if (text.contains(keyword)) {
                promoHits++;
            }
        }
        if (promoHits > 0) {
            score += Math.min(PROMO_CAP, promoHits * PROMO_HIT);
            if (promoHits >= 2) {
                flags.add("promotional_keywords");
            }
        }

        long exclamations = raw.chars().filter(c -> c == '!').count();
        if (exclamations >= 3) {
            score += 0.15;
        }

        long letters = raw.chars().filter(Character::isLetter).count();
        long upper = raw.chars().filter(Character::isUpperCase).count();
        if (letters > 10 && (double) upper / letters > 0.3) {
            score += 0.2;
            flags.add("excessive_caps");
        }

        if (REPEATED_CHARS.matcher(text).find()) {
            score += 0.15;
        }
        if (LINK.matcher(text).find()) {
            score += 0.3;
            flags.add("contains_links");
        }
        if (PHONE.matcher(text).find() || EMAIL.matcher(text).find() || MESSENGER.matcher(text).find()) {
            score += 0.25;
            flags.add("contact_info");
        }
        if (text.trim().length() < 10) {
            score += 0.2;
        }
        return score;
    }

    private double scoreToxicity(String text, Set<String> flags) {
        double score = 0.0;
        for (String term : ABUSIVE_TERMS) {
            if (text.contains(term)) {
                score += 0.8;
                flags.add("toxic_language");
                break;
            }
        }
        if (PROFANITY.matcher(text).find()) {
            score += 0.3;
            flags.add("toxic_language");
        }
        for (Pattern pattern : AGGRESSIVE) {
            if (pattern.matcher(text).find()) {
                score += 0.4;
                flags.add("aggressive_tone");
                break;
            }
        }
        return score;
    }

    private double scoreCulturalContext(String raw, String text, Set<String> flags) {
        double adjustment = 0.0;
        int markers = 0;
        for (String word : text.split("\\s+")) {
            if (HINGLISH_MARKERS.contains(word)) {
                markers++;
            }
        }
        if (markers >= 2 || DEVANAGARI.matcher(raw).find()) {
            flags.add(SignalScores.FLAG_BILINGUAL);
            adjustment += 0.3;
        }
        for (String idiom : REGIONAL_IDIOMS) {
            if (text.contains(idiom)) {
                flags.add(SignalScores.FLAG_REGIONAL_IDIOM);
                adjustment += 0.2;
                break;
            }
        }
        return Math.min(0.5, adjustment);
    }

    private double scoreQuality(String raw, double spam, double toxicity, ContentType contentType) {
        String trimmed = raw.trim();
        double score = 0.5;
        if (trimmed.length() >= 100) {
            score += 0.2;
        }
        if (trimmed.length() >= 300) {
            score += 0.1;
        }
        if (trimmed.split("[.!?]+\\s").length >= 2) {
            score += 0.1;
        }
        if (contentType == ContentType.QUESTION && trimmed.endsWith("?")) {
            score += 0.05;
        }
        return score - 0.5 * spam - 0.5 * toxicity;
    }
}
