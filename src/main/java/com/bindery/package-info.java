/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Bindery is a small data-access layer over JDBC: named variables bound into SQL templates, CRUD dispatch over
 * capability-typed domain objects, and PostgreSQL {@code LISTEN}/{@code NOTIFY} subscriptions.
 *
 * <pre>
 * Database database = Database.withDataSource(dataSource).build();
 *
 * // A domain type takes part by implementing Selector, Writer, Reader or ListReader
 * class Employee implements Selector, Writer, Reader {
 *   public String select(Bind bind, Operation operation) {
 *     switch (operation) {
 *       case GET: return "SELECT id, name FROM employee WHERE id = " + bind.set("id", id);
 *       default: throw new NotImplementedException(operation);
 *     }
 *   }
 *   ...
 * }
 *
 * database.with("id", 42).get(employee, employee);
 *
 * // Templates
 * database.with("schema", "hr", "names", List.of("Ann", "Bo"))
 *   .list(employees, (bind, operation) -&gt; "SELECT * FROM ${\"schema\"}.employee WHERE name IN (${'names'})");
 *
 * // Transactions
 * database.tx(conn -&gt; {
 *   conn.insert(employee, employee);
 *   conn.exec("UPDATE department SET size = size + 1 WHERE id = " + conn.bind().set("department", departmentId));
 * });
 *
 * // Notifications
 * try (Listener listener = database.listener()) {
 *   listener.listen("jobs");
 *   Notification notification = listener.waitForNotification();
 * }</pre>
 *
 * @since 1.0.0
 */
package com.bindery;
