package com.skillflow.actions;

import com.skillflow.shared.model.ActionOutput;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

public class WriteFileAction implements Action {

    @Override public String skillId() { return "write_file"; }

    @Override
    public ActionOutput execute(ActionContext ctx, Map<String, Object> parameters) {
        var path = ActionPaths.resolve(ctx, parameters.get("path"));
        var content = String.valueOf(parameters.get("content"));
        try {
            var parent = path.getParent();
            if (parent != null) Files.createDirectories(parent);
            var bytes = content.getBytes(StandardCharsets.UTF_8);
            Files.write(path, bytes);
            return new ActionOutput(path.toString(), Map.of("bytes", bytes.length));
        } catch (IOException e) {
            throw ActionPaths.translate(e, path);
        }
    }
}
