package org.stepaas.assembly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 基于分号分隔字典文件的分类服务。
 * <p>
 * 文件格式：{@code semanticId;preferredName;definition}，首行为表头，{@code #} 开头的行为注释。
 * <p>
 * 查询顺序：
 * <ol>
 *   <li>preferredName 与标签完全相同（大小写无关）</li>
 *   <li>preferredName 包含标签的条目中，编辑距离最小者（相同时取文件中靠前者）</li>
 *   <li>否则 {@link SemanticLookup#NONE}</li>
 * </ol>
 * 查询结果按标签缓存（单次运行内同一标签会被反复查询）。
 */
public class DictionaryTaxonomyService implements TaxonomyService {

    private static final Logger log = LoggerFactory.getLogger(DictionaryTaxonomyService.class);

    private record Entry(String semanticId, String preferredName, String definition) {
    }

    private final List<Entry> entries;
    private final Map<String, SemanticLookup> cache = new HashMap<>();

    public DictionaryTaxonomyService(Resource dictionary) {
        this.entries = load(dictionary);
        log.info("分类字典已加载：{} 条（{}）", entries.size(), dictionary.getDescription());
    }

    @Override
    public synchronized SemanticLookup lookup(String label) {
        if (label == null || label.isBlank()) {
            return SemanticLookup.NONE;
        }
        return cache.computeIfAbsent(label.strip(), this::find);
    }

    private SemanticLookup find(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        Entry best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (Entry e : entries) {
            String name = e.preferredName().toLowerCase(Locale.ROOT);
            if (name.equals(lower)) {
                return toLookup(e);
            }
            if (name.contains(lower)) {
                int distance = levenshtein(label, e.preferredName());
                if (distance < bestDistance) {
                    best = e;
                    bestDistance = distance;
                }
            }
        }
        return (best == null) ? SemanticLookup.NONE : toLookup(best);
    }

    private static SemanticLookup toLookup(Entry e) {
        return new SemanticLookup(e.semanticId(), List.of(e.preferredName(), e.definition()));
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = (a.charAt(i - 1) == b.charAt(j - 1)) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    private static List<Entry> load(Resource dictionary) {
        List<Entry> out = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(dictionary.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            boolean header = true;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                if (header) {
                    header = false;
                    continue;
                }
                String[] cells = line.split(";", -1);
                if (cells.length < 2 || cells[0].isBlank() || cells[1].isBlank()) {
                    continue;
                }
                out.add(new Entry(cells[0].strip(), cells[1].strip(), cells.length > 2 ? cells[2].strip() : ""));
            }
        } catch (IOException e) {
            throw new IllegalStateException("分类字典读取失败：" + dictionary.getDescription(), e);
        }
        return List.copyOf(out);
    }
}
