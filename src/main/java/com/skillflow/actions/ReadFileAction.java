package com.skillflow.actions;

import com.skillflow.shared.model.ActionOutput;
import com.skillflow.shared.model.SkillException;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;

import static com.skillflow.shared.model.SkillException.Kind.IO_ERROR;
import static com.skillflow.shared.model.SkillException.Kind.PATH_NOT_FOUND;

public class ReadFileAction implements Action {

    @Override public String skillId() { return "read_file"; }

    @Override
    public ActionOutput execute(ActionContext ctx, Map<String, Object> parameters) {
        var path = ActionPaths.resolve(ctx, parameters.get("path"));
        if (!Files.exists(path)) {
            throw new SkillException(PATH_NOT_FOUND, path.toString(), "File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new SkillException(IO_ERROR, path.toString(), path + " is not a file");
        }
        try {
            return new ActionOutput(Files.readString(path), Map.of("path", path.toString()));
        } catch (IOException e) {
            throw ActionPaths.translate(e, path);
        }
    }
}
