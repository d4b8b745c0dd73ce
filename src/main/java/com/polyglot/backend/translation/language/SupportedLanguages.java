package com.polyglot.backend.translation.language;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 支援的語言清單（code → 名稱），來源是 classpath 的 languages.tsv。
 * 同一個名稱對到多個 code 時（例如 hebrew：iw / he），以檔案中較後面的為準。
 */
@Component
public class SupportedLanguages {

    public static final String RESOURCE = "languages.tsv";

    public record Language(String code, String name) {}

    private final Map<String, String> nameByCode;
    private final Map<String, String> codeByName;

    public SupportedLanguages() {
        this(RESOURCE);
    }

    SupportedLanguages(String resource) {
        Map<String, String> byCode = new LinkedHashMap<>();
        Map<String, String> byName = new HashMap<>();

        var res = new ClassPathResource(resource);
        try (var reader = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) continue;
                int tab = line.indexOf('\t');
                if (tab <= 0) continue;
                String code = line.substring(0, tab).trim().toLowerCase(Locale.ROOT);
                String name = line.substring(tab + 1).trim().toLowerCase(Locale.ROOT);
                byCode.put(code, name);
                byName.put(name, code);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("LANGUAGE_CATALOG_UNREADABLE: " + resource, e);
        }

        if (byCode.isEmpty()) throw new IllegalStateException("LANGUAGE_CATALOG_EMPTY: " + resource);

        this.nameByCode = Collections.unmodifiableMap(byCode);
        this.codeByName = Collections.unmodifiableMap(byName);
    }

    public boolean isSupported(String code) {
        return code != null && nameByCode.containsKey(code.trim().toLowerCase(Locale.ROOT));
    }

    /** 找不到回 null */
    public String nameOf(String code) {
        if (code == null) return null;
        return nameByCode.get(code.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 接受 code 或語言名稱（不分大小寫），回傳正規化後的 code；都對不上就回 null。
     */
    public String resolve(String codeOrName) {
        if (codeOrName == null || codeOrName.isBlank()) return null;
        String v = codeOrName.trim().toLowerCase(Locale.ROOT);
        if (nameByCode.containsKey(v)) return v;
        return codeByName.get(v);
    }

    /** 依名稱排序（名稱相同時依 code） */
    public List<Language> all() {
        List<Language> out = new ArrayList<>(nameByCode.size());
        nameByCode.forEach((code, name) -> out.add(new Language(code, name)));
        out.sort(Comparator.comparing(Language::name).thenComparing(Language::code));
        return out;
    }

    public int size() {
        return nameByCode.size();
    }
}
