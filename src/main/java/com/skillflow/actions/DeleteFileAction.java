package com.skillflow.actions;

import com.skillflow.shared.model.ActionOutput;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;

public class DeleteFileAction implements Action {

    @Override public String skillId() { return "delete_file"; }

    @Override
    public ActionOutput execute(ActionContext ctx, Map<String, Object> parameters) {
        var path = ActionPaths.resolve(ctx, parameters.get("path"));
        try {
            Files.delete(path);
            return ActionOutput.of(path.toString());
        } catch (IOException e) {
            throw ActionPaths.translate(e, path);
        }
    }
}
