package metahub.addon.core.domain.config;

/** MyAnimeList options of a user configuration. */
public record MalSettings(boolean enabled, boolean skipFiller, boolean skipRecap) {

  public static MalSettings disabled() {
    return new MalSettings(false, false, false);
  }
}
