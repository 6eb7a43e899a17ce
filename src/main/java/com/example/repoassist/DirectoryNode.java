package com.example.repoassist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Node of the acyclic directory tree built once per ingestion. The tree is never patched: a
 * re-ingestion builds a new one.
 */
public class DirectoryNode {

    private final String path;
    private final Map<String, DirectoryNode> children = new TreeMap<>();
    private final List<String> filePaths = new ArrayList<>();
    private String tag;

    public DirectoryNode(String path) {
        this.path = path;
    }

    /** Builds the tree for the given repository-relative file paths ("" is the root). */
    public static DirectoryNode build(Iterable<String> paths) {
        DirectoryNode root = new DirectoryNode("");
        for (String p : paths) {
            DirectoryNode node = root;
            String[] parts = p.split("/");
            StringBuilder prefix = new StringBuilder();
            for (int i = 0; i < parts.length - 1; i++) {
                if (prefix.length() > 0) prefix.append('/');
                prefix.append(parts[i]);
                String childPath = prefix.toString();
                node = node.children.computeIfAbsent(parts[i], k -> new DirectoryNode(childPath));
            }
            node.filePaths.add(p);
        }
        return root;
    }

    /** Directories grouped from deepest to shallowest. */
    public List<List<DirectoryNode>> levelsDeepestFirst() {
        List<List<DirectoryNode>> levels = new ArrayList<>();
        collect(this, 0, levels);
        Collections.reverse(levels);
        return levels;
    }

    private static void collect(DirectoryNode node, int depth, List<List<DirectoryNode>> levels) {
        while (levels.size() <= depth) levels.add(new ArrayList<>());
        levels.get(depth).add(node);
        for (DirectoryNode child : node.children.values()) {
            collect(child, depth + 1, levels);
        }
    }

    public DirectoryNode find(String dirPath) {
        if (dirPath == null || dirPath.isEmpty()) return this;
        DirectoryNode node = this;
        for (String part : dirPath.split("/")) {
            node = node.children.get(part);
            if (node == null) return null;
        }
        return node;
    }

    public String getPath() { return path; }
    public List<DirectoryNode> getChildren() { return new ArrayList<>(children.values()); }
    public List<String> getFilePaths() { return Collections.unmodifiableList(filePaths); }
    public String getTag() { return tag; }
    void setTag(String tag) { this.tag = tag; }
}
