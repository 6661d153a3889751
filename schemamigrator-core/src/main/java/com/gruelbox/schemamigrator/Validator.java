package com.gruelbox.schemamigrator;

import java.util.regex.Pattern;

public final class Validator {

  private final String path;

  public Validator() {
    this.path = "";
  }

  private Validator(String path) {
    this.path = path;
  }

  public void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName()));
  }

  public void valid(String propertyName, Object object) {
    notNull(propertyName, object);
    if (!(object instanceof Validatable)) {
      return;
    }
    ((Validatable) object)
        .validate(new Validator(path.isEmpty() ? propertyName : (path + "." + propertyName)));
  }

  public void notNull(String propertyName, Object object) {
    if (object == null) {
      error(propertyName, "may not be null");
    }
  }

  public void isTrue(String propertyName, boolean condition, String message, Object... args) {
    if (!condition) {
      error(propertyName, String.format(message, args));
    }
  }

  public void notBlank(String propertyName, String object) {
    notNull(propertyName, object);
    if (object.isEmpty()) {
      error(propertyName, "may not be blank");
    }
  }

  public void matches(String propertyName, String object, Pattern pattern) {
    notBlank(propertyName, object);
    if (!pattern.matcher(object).matches()) {
      error(propertyName, "must match " + pattern.pattern() + " but was '" + object + "'");
    }
  }

  public void positiveOrZero(String propertyName, int object) {
    min(propertyName, object, 0);
  }

  public void min(String propertyName, int object, int minimumValue) {
    if (object < minimumValue) {
      error(propertyName, "must be greater than " + minimumValue);
    }
  }

  private void error(String propertyName, String message) {
    throw new IllegalArgumentException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}
