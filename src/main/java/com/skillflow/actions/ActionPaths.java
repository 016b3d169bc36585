package com.skillflow.actions;

import com.skillflow.shared.model.SkillException;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static com.skillflow.shared.model.SkillException.Kind.IO_ERROR;
import static com.skillflow.shared.model.SkillException.Kind.PATH_NOT_FOUND;
import static com.skillflow.shared.model.SkillException.Kind.PERMISSION_DENIED;

final class ActionPaths {

    private ActionPaths() {}

    static Path resolve(ActionContext ctx, Object raw) {
        try {
            var p = Path.of(String.valueOf(raw));
            if (!p.isAbsolute() && ctx.workDir() != null) {
                p = Path.of(ctx.workDir()).resolve(p);
            }
            return p.toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new SkillException(IO_ERROR, "path", "Invalid path: " + raw, e);
        }
    }

    static SkillException translate(IOException e, Path path) {
        if (e instanceof NoSuchFileException) {
            return new SkillException(PATH_NOT_FOUND, path.toString(), "File not found: " + path, e);
        }
        if (e instanceof AccessDeniedException) {
            return new SkillException(PERMISSION_DENIED, path.toString(), "Permission denied: " + path, e);
        }
        return new SkillException(IO_ERROR, path.toString(), "IO error on " + path + ": " + e.getMessage(), e);
    }
}
