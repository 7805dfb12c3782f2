package org.dxworks.mdsplit.splitter;

import org.dxworks.mdsplit.model.Section;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Second pass of the splitter: fills in the parent chain and the sibling list of every section.
 * Needs the complete section list, since a section's siblings may come after it.
 */
class SectionRelations {

    void apply(List<Section> sections) {
        assignParents(sections);
        assignSiblings(sections);
    }

    private void assignParents(List<Section> sections) {
        // level -> header of the nearest open heading at that level
        TreeMap<Integer, String> openAncestors = new TreeMap<>();

        for (Section section : sections) {
            int level = section.headerLevel;
            openAncestors.tailMap(level, true).clear();

            Map<String, String> parents = new LinkedHashMap<>();
            for (Map.Entry<Integer, String> ancestor : openAncestors.entrySet()) {
                parents.put(levelLabel(ancestor.getKey()), ancestor.getValue());
            }
            section.metadata.parents = parents;

            openAncestors.put(level, section.sectionHeader);
        }
    }

    private void assignSiblings(List<Section> sections) {
        Map<SiblingKey, List<Section>> groups = new LinkedHashMap<>();
        for (Section section : sections) {
            SiblingKey key = new SiblingKey(section.headerLevel, section.metadata.parents);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(section);
        }

        for (List<Section> group : groups.values()) {
            for (Section section : group) {
                Set<String> siblings = new LinkedHashSet<>();
                for (Section other : group) {
                    if (!other.sectionHeader.equals(section.sectionHeader)) {
                        siblings.add(other.sectionHeader);
                    }
                }
                section.metadata.siblings = new ArrayList<>(siblings);
            }
        }
    }

    static String levelLabel(int level) {
        return "h" + level;
    }

    private static final class SiblingKey {
        private final int level;
        private final Map<String, String> parents;

        SiblingKey(int level, Map<String, String> parents) {
            this.level = level;
            this.parents = parents;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SiblingKey)) return false;
            SiblingKey other = (SiblingKey) o;
            return level == other.level && parents.equals(other.parents);
        }

        @Override
        public int hashCode() {
            return Objects.hash(level, parents);
        }
    }
}
