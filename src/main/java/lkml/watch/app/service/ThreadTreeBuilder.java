package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.model.ReplyHierarchy;
import lkml.watch.app.model.ThreadNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Arranges a set of messages into a parent/child tree.
 * Sub-patches always hang off the root, and a message whose parent is unknown does too.
 * Siblings are ordered by receive time, then by message id.
 */
@Component
public class ThreadTreeBuilder {
    private static final Comparator<FeedMessage> CHRONOLOGICAL =
            Comparator.comparing(FeedMessage::getReceivedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(FeedMessage::getMessageIdHeader);

    /**
     * @param anchorId message every orphan attaches to; when null, orphans become top-level entries
     * @param subPatchIds messages forced under the anchor regardless of their references
     */
    public ReplyHierarchy buildHierarchy(Collection<FeedMessage> messages, String anchorId, Set<String> subPatchIds) {
        Map<String, FeedMessage> byId = new LinkedHashMap<>();
        messages.stream()
                .filter(m -> m.getMessageIdHeader() != null)
                .sorted(CHRONOLOGICAL)
                .forEach(m -> byId.putIfAbsent(m.getMessageIdHeader(), m));

        Map<String, String> parentOf = new HashMap<>();
        for (FeedMessage message : byId.values()) {
            String id = message.getMessageIdHeader();
            if (id.equals(anchorId)) {
                continue;
            }
            String parent = anchorId;
            if (!subPatchIds.contains(id)) {
                String reference = MessageIds.primaryReference(message.getInReplyToHeader());
                if (reference != null && !reference.equals(id) && byId.containsKey(reference)) {
                    parent = reference;
                }
            }
            parentOf.put(id, parent);
        }

        breakCycles(byId.keySet(), parentOf, anchorId);

        Map<String, List<String>> children = new HashMap<>();
        List<String> rootIds = new ArrayList<>();
        for (String id : byId.keySet()) {
            if (id.equals(anchorId)) {
                rootIds.add(id);
                continue;
            }
            String parent = parentOf.get(id);
            if (parent == null || !byId.containsKey(parent)) {
                rootIds.add(id);
            } else {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(id);
            }
        }

        // byId is already chronological, so child lists come out sorted
        Map<String, ReplyHierarchy.Entry> entries = new LinkedHashMap<>();
        for (Map.Entry<String, FeedMessage> e : byId.entrySet()) {
            entries.put(e.getKey(), new ReplyHierarchy.Entry(e.getValue(),
                    List.copyOf(children.getOrDefault(e.getKey(), List.of()))));
        }
        return new ReplyHierarchy(entries, List.copyOf(rootIds));
    }

    // A message whose ancestry loops back on itself is moved under the anchor
    private void breakCycles(Set<String> ids, Map<String, String> parentOf, String anchorId) {
        for (String id : ids) {
            Set<String> seen = new HashSet<>();
            String current = id;
            while (current != null && !current.equals(anchorId)) {
                if (!seen.add(current)) {
                    parentOf.put(id, anchorId);
                    break;
                }
                current = parentOf.get(current);
            }
        }
    }

    /**
     * Tree rooted at a card's root message.
     * @param root the card's root message, included even if absent from {@code messages}
     * @param subPatchIds ids of the series sub-patches
     */
    public ThreadNode buildTree(FeedMessage root, Collection<FeedMessage> messages, Set<String> subPatchIds) {
        List<FeedMessage> all = new ArrayList<>();
        all.add(root);
        all.addAll(messages);
        return buildTree(root, buildHierarchy(all, root.getMessageIdHeader(), subPatchIds), subPatchIds);
    }

    public ThreadNode buildTree(FeedMessage root, ReplyHierarchy hierarchy, Set<String> subPatchIds) {
        return toNode(root.getMessageIdHeader(), root, hierarchy, subPatchIds, new HashSet<>());
    }

    private ThreadNode toNode(String id, FeedMessage root, ReplyHierarchy hierarchy,
                              Set<String> subPatchIds, Set<String> visited) {
        visited.add(id);
        List<ThreadNode> children = hierarchy.childrenOf(id).stream()
                .filter(child -> !visited.contains(child))
                .map(child -> toNode(child, root, hierarchy, subPatchIds, visited))
                .collect(Collectors.toList());
        FeedMessage message = hierarchy.messageOf(id);
        return new ThreadNode(message != null ? message : root, children, typeOf(id, root, subPatchIds));
    }

    private ThreadNode.NodeType typeOf(String id, FeedMessage root, Set<String> subPatchIds) {
        if (id.equals(root.getMessageIdHeader())) {
            return root.isCoverLetter() ? ThreadNode.NodeType.COVER_LETTER : ThreadNode.NodeType.SUB_PATCH;
        }
        return subPatchIds.contains(id) ? ThreadNode.NodeType.SUB_PATCH : ThreadNode.NodeType.REPLY;
    }
}
