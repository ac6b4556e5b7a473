/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.thorc.cbackend;

import com.google.common.collect.ImmutableSet;

/**
 * Generates C identifiers for Thor functions and variables.
 *
 * Functions of named modules are prefixed with the module name, so
 * that helper in module math becomes math_helper.  Names that are
 * legal in Thor but reserved in C get a trailing underscore.
 */
public class CNamer {

  /** Declared by the headers every generated file includes */
  private static final ImmutableSet<String> libraryNames =
      ImmutableSet.<String>builder()
        // stdio.h
        .add("FILE", "fpos_t", "EOF", "BUFSIZ", "FILENAME_MAX",
             "FOPEN_MAX", "L_tmpnam", "TMP_MAX", "SEEK_SET", "SEEK_CUR",
             "SEEK_END", "_IOFBF", "_IOLBF", "_IONBF", "stdin", "stdout",
             "stderr", "printf", "fprintf", "sprintf", "snprintf",
             "vprintf", "vfprintf", "vsprintf", "vsnprintf", "scanf",
             "fscanf", "sscanf", "vscanf", "vfscanf", "vsscanf", "puts",
             "fputs", "gets", "fgets", "putchar", "putc", "fputc",
             "getchar", "getc", "fgetc", "ungetc", "fopen", "fclose",
             "freopen", "fflush", "fread", "fwrite", "fseek", "ftell",
             "rewind", "fgetpos", "fsetpos", "feof", "ferror", "clearerr",
             "perror", "remove", "rename", "tmpfile", "tmpnam", "setbuf",
             "setvbuf")
        // stdlib.h
        .add("size_t", "wchar_t", "div_t", "ldiv_t", "lldiv_t", "NULL",
             "EXIT_SUCCESS", "EXIT_FAILURE", "RAND_MAX", "MB_CUR_MAX",
             "malloc", "calloc", "realloc", "free", "aligned_alloc",
             "exit", "abort", "atexit", "at_quick_exit", "quick_exit",
             "_Exit", "getenv", "system", "atoi", "atol", "atoll", "atof",
             "strtol", "strtoll", "strtoul", "strtoull", "strtod",
             "strtof", "strtold", "abs", "labs", "llabs", "div", "ldiv",
             "lldiv", "rand", "srand", "qsort", "bsearch", "mblen",
             "mbtowc", "wctomb", "mbstowcs", "wcstombs")
        // string.h
        .add("strcmp", "strncmp", "strcoll", "strlen", "strcpy",
             "strncpy", "strcat", "strncat", "strchr", "strrchr",
             "strstr", "strtok", "strspn", "strcspn", "strpbrk",
             "strerror", "strxfrm", "memcpy", "memmove", "memset",
             "memcmp", "memchr")
        // stdbool.h, stdarg.h
        .add("bool", "true", "false", "__bool_true_false_are_defined",
             "va_list", "va_start", "va_end", "va_arg", "va_copy")
        .build();

  /** C keywords and names the generated code relies on */
  private static final ImmutableSet<String> reserved =
      ImmutableSet.<String>builder()
        .add("auto", "break", "case", "char", "const", "continue",
             "default", "do", "double", "enum", "extern", "goto", "long",
             "register", "short", "signed", "sizeof", "static", "struct",
             "switch", "typedef", "union", "unsigned", "volatile",
             "inline", "restrict", "_Bool", "_Alignas", "_Alignof",
             "_Atomic", "_Complex", "_Generic", "_Imaginary", "_Noreturn",
             "_Static_assert", "_Thread_local")
        .addAll(libraryNames)
        .add(CGenerator.TOPLEVEL_PROC)
        .add(CRuntime.Helper.INPUT.symbol, CRuntime.Helper.PRINTLN.symbol,
             CRuntime.Helper.STRING_EQUALS.symbol,
             CRuntime.Helper.FORMAT_STRING.symbol)
        .build();

  /**
   * @param name
   * @return true if a C library header already declares name
   */
  public static boolean isLibraryName(String name) {
    return libraryNames.contains(name);
  }

  /**
   * @param module defining module, null for the entry module
   * @param name
   * @return C function name
   */
  public static String functionName(String module, String name) {
    if (module == null) {
      return safeName(name);
    }
    return sanitize(module) + "_" + name;
  }

  /**
   * @param name Thor variable or parameter name
   * @return C name, differing only if name is reserved in C
   */
  public static String varName(String name) {
    return safeName(name);
  }

  private static String safeName(String name) {
    if (reserved.contains(name)) {
      return name + "_";
    }
    return name;
  }

  /**
   * Module names come from file names and may contain characters
   * such as '-' or '.'
   */
  static String sanitize(String module) {
    StringBuilder sb = new StringBuilder(module.length());
    for (int i = 0; i < module.length(); i++) {
      char c = module.charAt(i);
      if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' ||
          (i > 0 && c >= '0' && c <= '9')) {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    return sb.toString();
  }
}
