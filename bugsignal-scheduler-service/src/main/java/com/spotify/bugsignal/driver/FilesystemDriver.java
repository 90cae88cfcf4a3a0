/*-
 * -\-\-
 * BugSignal Scheduler Service
 * --
 * Copyright (C) 2024 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */
package com.spotify.bugsignal.driver;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.spotify.bugsignal.model.DriverKind;
import com.spotify.bugsignal.util.Time;
import com.spotify.bugsignal.util.TimeUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks files and directories below a set of roots.
 *
 * <p>A root that is a regular file is tracked by modification time. A directory root is tracked by
 * its recursive member set, unless a mask is given, in which case every regular file below it
 * whose relative path or file name matches the mask is tracked as a file.
 */
public class FilesystemDriver extends AbstractSourceDriver<FilesystemCheckpoint> {

  private static final Logger LOG = LoggerFactory.getLogger(FilesystemDriver.class);

  static final String SINGLE_MESSAGE_HEADER = "Modified files:";

  private final ImmutableList<Path> roots;
  private final Optional<PathMatcher> mask;
  private final boolean singleMessage;
  private final ZoneId zone;
  private final Time time;

  public FilesystemDriver(FilesystemParameters parameters, ZoneId zone, Time time) throws IOException {
    this(roots(parameters), matcher(parameters.mask()), parameters.singleMessage(), zone, time);
  }

  private FilesystemDriver(ImmutableList<Path> roots, Optional<PathMatcher> mask, boolean singleMessage,
      ZoneId zone, Time time) throws IOException {
    super(DriverKind.FILESYSTEM, FilesystemCheckpoint.of(time.get(), snapshot(roots, mask)));
    this.roots = roots;
    this.mask = mask;
    this.singleMessage = singleMessage;
    this.zone = requireNonNull(zone);
    this.time = requireNonNull(time);
  }

  @Override
  protected Observation<FilesystemCheckpoint> observe(FilesystemCheckpoint checkpoint) throws IOException {
    final Instant observed = time.get();
    final Map<String, ItemState> current = snapshot(roots, mask);
    final Map<String, ItemState> previous = checkpoint.items();

    final List<String> reports = new ArrayList<>();
    for (String path : new TreeSet<>(Sets.union(previous.keySet(), current.keySet()))) {
      diff(path, previous.get(path), current.get(path), checkpoint.updated(), reports);
    }

    final List<String> messages;
    if (singleMessage && !reports.isEmpty()) {
      messages = ImmutableList.of(SINGLE_MESSAGE_HEADER + "\n" + String.join("\n", reports));
    } else {
      messages = reports;
    }
    return Observation.of(messages, FilesystemCheckpoint.of(observed, current));
  }

  private void diff(String path, ItemState before, ItemState after, Instant since, List<String> reports) {
    if (before == null && after == null) {
      return;
    }
    if (before == null) {
      reports.add(created(path, after));
    } else if (after == null) {
      reports.add(removed(path, before));
    } else if (before.type() != after.type()) {
      reports.add(removed(path, before));
      reports.add(created(path, after));
    } else if (after.type() == ItemState.Type.FILE) {
      // an unchanged mtime newer than the checkpoint was already reported
      if (after.modified().isAfter(since) && !after.modified().equals(before.modified())) {
        reports.add("File modified: " + path + " at " + TimeUtil.format(after.modified(), zone));
      }
    } else {
      final int added = Sets.difference(after.members(), before.members()).size();
      final int removed = Sets.difference(before.members(), after.members()).size();
      if (added > 0 || removed > 0) {
        reports.add("Directory " + path + " changed: added " + added + " file(s); removed " + removed + " file(s)");
      }
    }
  }

  private static String created(String path, ItemState state) {
    return (state.type() == ItemState.Type.FILE ? "File created: " : "Directory created: ") + path;
  }

  private static String removed(String path, ItemState state) {
    return (state.type() == ItemState.Type.FILE ? "File removed: " : "Directory removed: ") + path;
  }

  /**
   * Keeps the inherited state of every item this driver still tracks, so that changes that
   * happened between the last check of the predecessor and now are still reported.
   */
  @Override
  protected FilesystemCheckpoint merge(FilesystemCheckpoint fresh, FilesystemCheckpoint inherited) {
    final Map<String, ItemState> items = new TreeMap<>(fresh.items());
    inherited.items().forEach((path, state) -> {
      if (covers(Paths.get(path))) {
        items.put(path, state);
      }
    });
    return FilesystemCheckpoint.of(inherited.updated(), items);
  }

  boolean covers(Path path) {
    for (Path root : roots) {
      if (path.equals(root)) {
        return mask.isEmpty() || !Files.isDirectory(root);
      }
      if (path.startsWith(root)) {
        return mask.isEmpty() || matches(mask.get(), root.relativize(path));
      }
    }
    return false;
  }

  @Override
  public void close() {
    // holds no resources
  }

  private static ImmutableList<Path> roots(FilesystemParameters parameters) {
    return parameters.paths().stream()
        .map(p -> Paths.get(p).normalize())
        .distinct()
        .collect(ImmutableList.toImmutableList());
  }

  private static Optional<PathMatcher> matcher(Optional<String> mask) {
    return mask.map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob));
  }

  private static boolean matches(PathMatcher matcher, Path relative) {
    final Path fileName = relative.getFileName();
    return matcher.matches(relative) || (fileName != null && matcher.matches(fileName));
  }

  private static Map<String, ItemState> snapshot(List<Path> roots, Optional<PathMatcher> mask) throws IOException {
    final Map<String, ItemState> items = new TreeMap<>();
    for (Path root : roots) {
      try {
        if (Files.isRegularFile(root)) {
          items.put(root.toString(), ItemState.file(modified(root)));
        } else if (Files.isDirectory(root)) {
          if (mask.isPresent()) {
            for (Path file : files(root)) {
              if (matches(mask.get(), root.relativize(file))) {
                items.put(file.toString(), ItemState.file(modified(file)));
              }
            }
          } else {
            final Set<String> members = new TreeSet<>();
            for (Path file : files(root)) {
              members.add(root.relativize(file).toString());
            }
            items.put(root.toString(), ItemState.directory(modified(root), members));
          }
        }
      } catch (NoSuchFileException e) {
        LOG.debug("{} disappeared while observing it", e.getFile());
      }
    }
    return items;
  }

  private static List<Path> files(Path directory) throws IOException {
    try (Stream<Path> walk = Files.walk(directory)) {
      return walk.filter(Files::isRegularFile).sorted().collect(ImmutableList.toImmutableList());
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  private static Instant modified(Path path) throws IOException {
    return Files.getLastModifiedTime(path).toInstant();
  }
}
