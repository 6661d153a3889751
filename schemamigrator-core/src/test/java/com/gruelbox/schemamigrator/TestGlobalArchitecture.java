package com.gruelbox.schemamigrator;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;

import com.gruelbox.schemamigrator.backup.BackupManager;
import com.gruelbox.schemamigrator.diff.SchemaDiffer;
import com.gruelbox.schemamigrator.schema.SchemaSnapshot;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import org.junit.jupiter.api.Test;

/** Keeps schema comparison independent of the database and of backups. */
class TestGlobalArchitecture {

  private static final JavaClasses all =
      new ClassFileImporter().importPackagesOf(MigrationExecutor.class);

  @Test
  void no_diff_access_to_jdbc_or_backups() {
    classes()
        .that()
        .resideInAPackage(SchemaDiffer.class.getPackageName())
        .should()
        .onlyAccessClassesThat()
        .resideOutsideOfPackages(BackupManager.class.getPackageName(), "java.sql..")
        .check(all);
  }

  @Test
  void no_schema_access_to_diffs_or_backups() {
    classes()
        .that()
        .resideInAPackage(SchemaSnapshot.class.getPackageName())
        .should()
        .onlyAccessClassesThat()
        .resideOutsideOfPackages(
            BackupManager.class.getPackageName(), SchemaDiffer.class.getPackageName())
        .check(all);
  }
}
