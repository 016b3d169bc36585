package com.skillflow.actions;

import com.skillflow.shared.model.ActionOutput;
import com.skillflow.shared.model.SkillException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.skillflow.shared.model.SkillException.Kind.IO_ERROR;
import static com.skillflow.shared.model.SkillException.Kind.PATH_NOT_FOUND;

/** Directories first, then files, each group alphabetically ignoring case. */
public class ListDirectoryAction implements Action {

    @Override public String skillId() { return "list_directory"; }

    @Override
    public ActionOutput execute(ActionContext ctx, Map<String, Object> parameters) {
        var dir = ActionPaths.resolve(ctx, parameters.get("path"));
        if (!Files.exists(dir)) {
            throw new SkillException(PATH_NOT_FOUND, dir.toString(), "Directory not found: " + dir);
        }
        if (!Files.isDirectory(dir)) {
            throw new SkillException(IO_ERROR, dir.toString(), dir + " is not a directory");
        }
        List<Path> children;
        try (var stream = Files.list(dir)) {
            children = stream
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString().toLowerCase()))
                    .toList();
        } catch (IOException e) {
            throw ActionPaths.translate(e, dir);
        }

        var entries = new ArrayList<Map<String, Object>>();
        for (var child : children) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("name", child.getFileName().toString());
            entry.put("directory", Files.isDirectory(child));
            entry.put("size", sizeOf(child));
            entries.add(entry);
        }
        var listing = children.stream()
                .map(p -> p.getFileName().toString() + (Files.isDirectory(p) ? "/" : ""))
                .collect(Collectors.joining("\n"));
        return new ActionOutput(listing, Map.of("entries", entries));
    }

    private static long sizeOf(Path p) {
        try {
            return Files.isRegularFile(p) ? Files.size(p) : 0L;
        } catch (IOException e) {
            throw ActionPaths.translate(e, p);
        }
    }
}
