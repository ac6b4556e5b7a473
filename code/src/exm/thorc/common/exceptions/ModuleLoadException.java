package exm.thorc.common.exceptions;

import java.io.IOException;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.thorc.ast.FilePosition;

/**
 * Exception thrown when loading module
 */
public class ModuleLoadException extends UserException {
  private static final long serialVersionUID = 1L;

  private final String moduleName;

  public ModuleLoadException(FilePosition pos, String moduleName,
                             String filePath, IOException cause) {
    super(pos, buildMessage(filePath, cause));
    this.moduleName = moduleName;
  }

  public ModuleLoadException(FilePosition pos, String moduleName,
                             List<String> searched) {
    super(pos, "Could not find module " + moduleName + ", tried: " +
               StringUtils.join(searched, ", "));
    this.moduleName = moduleName;
  }

  public String getModuleName() {
    return moduleName;
  }

  private static String buildMessage(String filePath, IOException cause) {
    return "Error occured while trying to load Thor source file: "
        + filePath + ": " + cause.getMessage();
  }

}
