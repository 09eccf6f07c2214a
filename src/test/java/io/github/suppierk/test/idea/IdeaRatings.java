package io.github.suppierk.test.idea;

import io.github.suppierk.eventsourcing.projection.Projection;
import io.github.suppierk.eventsourcing.projection.ProjectionHandler;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Read model of rating totals per idea. */
public final class IdeaRatings implements Projection {
  private final Map<String, Idea.View> views = new ConcurrentHashMap<>();

  public Map<String, Idea.View> views() {
    return Map.copyOf(views);
  }

  @Override
  public Map<String, ProjectionHandler> handlers() {
    return Map.of(
        "IdeaProposed",
        ProjectionHandler.of(
            IdeaProposed.class,
            (event, proposed) ->
                views.put(
                    event.aggregateId(),
                    new Idea.View(event.aggregateId(), proposed.title(), 0, 0))),
        "IdeaRated",
        ProjectionHandler.of(
            IdeaRated.class,
            (event, rated) ->
                views.computeIfPresent(
                    event.aggregateId(),
                    (id, view) ->
                        new Idea.View(
                            id,
                            view.title(),
                            view.ratingCount() + 1,
                            view.ratingTotal() + rated.rating()))));
  }

  @Override
  public void reset() {
    views.clear();
  }
}
