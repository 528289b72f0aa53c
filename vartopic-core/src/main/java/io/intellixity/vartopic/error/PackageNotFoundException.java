package io.intellixity.vartopic.error;

public final class PackageNotFoundException extends VartopicException {
  private final String packageName;

  public PackageNotFoundException(String packageName) {
    super("Package [" + packageName + "] not found");
    this.packageName = packageName;
  }

  public String packageName() { return packageName; }
}
