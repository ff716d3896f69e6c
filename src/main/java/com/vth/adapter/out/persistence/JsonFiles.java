package com.vth.adapter.out.persistence;

import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.CopyOptions;
import io.vertx.core.file.FileSystem;

import java.util.Optional;

/**
 * File helpers shared by the JSON repositories
 */
final class JsonFiles {

    private JsonFiles() {
    }

    /**
     * Write to a sibling temp file, then move it over the target so readers never see a partial file
     */
    static Future<Void> writeAtomically(FileSystem fs, String directory, String path, Buffer content) {
        String temp = path + ".tmp";
        return fs.mkdirs(directory)
                .compose(v -> fs.writeFile(temp, content))
                .compose(v -> fs.move(temp, path, new CopyOptions()
                        .setReplaceExisting(true)
                        .setAtomicMove(true)));
    }

    static Future<Optional<Buffer>> readIfExists(FileSystem fs, String path) {
        return fs.exists(path).compose(exists -> {
            if (!exists) {
                return Future.succeededFuture(Optional.<Buffer>empty());
            }
            return fs.readFile(path).map(Optional::of);
        });
    }
}
